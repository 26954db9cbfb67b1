package com.mike.leadscout.listing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Business category guessed from the query text. Decides which directories are worth asking first.
 */
public enum QueryCategory {
    MEDICAL(List.of(
            "doctor", "dentist", "physician", "surgeon", "dermatologist", "orthodontist", "pediatrician",
            "therapist", "psychiatrist", "cardiologist", "optometrist", "chiropractor", "physical therapy",
            "medical", "clinic", "healthcare", "dental", "hospital", "urgent care", "pharmacy", "veterinarian",
            "psychologist", "counselor", "ophthalmologist", "podiatrist", "neurologist", "oncologist")),
    HOME_SERVICES(List.of(
            "plumber", "electrician", "contractor", "roofer", "painter", "landscaper", "hvac", "handyman",
            "remodeling", "renovation", "flooring", "carpentry", "pest control", "cleaning", "mover",
            "garage door", "window", "siding", "fence", "drywall", "insulation", "solar", "pool", "septic",
            "plumbing", "electrical", "roofing", "painting", "lawn care", "tree service", "locksmith",
            "appliance repair", "foundation", "waterproofing", "gutter")),
    RESTAURANT_FOOD(List.of(
            "restaurant", "cafe", "coffee", "bakery", "pizza", "sushi", "italian", "mexican", "chinese",
            "thai", "indian", "bar", "pub", "brewery", "winery", "catering", "food truck", "deli", "bistro",
            "steakhouse", "seafood", "brunch", "breakfast", "takeout")),
    RETAIL(List.of(
            "store", "shop", "boutique", "outlet", "mall", "retail", "clothing", "jewelry", "furniture",
            "electronics", "hardware", "grocery", "supermarket", "bookstore", "florist", "antique")),
    PROFESSIONAL_SERVICES(List.of(
            "lawyer", "attorney", "accountant", "cpa", "financial advisor", "insurance", "real estate",
            "realtor", "architect", "engineer", "consultant", "marketing", "advertising", "law firm", "tax",
            "notary", "mortgage", "investment", "bank", "credit union", "wealth management")),
    BEAUTY_WELLNESS(List.of(
            "salon", "spa", "barber", "nail", "massage", "yoga", "gym", "fitness", "pilates", "crossfit",
            "personal trainer", "tattoo", "piercing", "waxing", "facial", "skincare", "aesthetician",
            "medspa", "wellness", "acupuncture", "hair stylist", "beauty", "cosmetic")),
    AUTOMOTIVE(List.of(
            "mechanic", "auto repair", "car dealer", "dealership", "auto body", "tire", "oil change",
            "car wash", "detailing", "towing", "transmission", "brake", "muffler", "alignment", "auto parts",
            "motorcycle")),
    ONLINE_BRAND(List.of(
            "dtc", "brand", "subscription", "startup", "maker", "artisan", "ecommerce", "e-commerce",
            "online store", "digital", "saas", "software", "tech company", "marketplace")),
    ENTERTAINMENT(List.of(
            "movie", "theater", "theatre", "cinema", "bowling", "arcade", "amusement", "entertainment",
            "nightclub", "casino", "concert", "venue", "escape room", "laser tag", "mini golf", "trampoline",
            "zoo", "aquarium", "museum", "gallery", "recreation")),
    EDUCATION(List.of(
            "school", "academy", "tutoring", "tutor", "learning", "daycare", "preschool", "kindergarten",
            "education", "training", "driving school", "music lessons", "dance school", "art class",
            "martial arts", "karate", "swimming lessons")),
    PET_SERVICES(List.of(
            "pet", "dog", "grooming", "dog walker", "pet sitter", "kennel", "boarding", "veterinary",
            "animal hospital", "dog training")),
    GENERAL_LOCAL(List.of()),
    GENERAL_ONLINE(List.of());

    private final Pattern matcher;

    QueryCategory(List<String> keywords) {
        this.matcher = keywords.isEmpty() ? null : Pattern.compile(keywords.stream()
                .map(QueryCategory::wordPattern)
                .collect(Collectors.joining("|", "\\b(?:", ")\\b")));
    }

    /**
     * First category with a keyword appearing as a whole word (plurals included); a general category otherwise.
     */
    public static QueryCategory detect(String query, boolean hasLocation) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (QueryCategory c : values()) {
            if (c.matcher != null && c.matcher.matcher(q).find()) return c;
        }
        return hasLocation ? GENERAL_LOCAL : GENERAL_ONLINE;
    }

    /**
     * "bakery" also matches "bakeries", "dentist" also matches "dentists".
     */
    private static String wordPattern(String keyword) {
        if (keyword.endsWith("y") && keyword.length() > 3) {
            String stem = Pattern.quote(keyword.substring(0, keyword.length() - 1));
            return stem + "(?:y|ies)";
        }
        return Pattern.quote(keyword) + "(?:s|es)?";
    }
}
