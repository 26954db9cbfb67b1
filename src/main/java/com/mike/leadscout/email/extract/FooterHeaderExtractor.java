package com.mike.leadscout.email.extract;

import com.mike.leadscout.browser.PageSnapshot;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Targets the blocks where small-business sites put contact details, with de-obfuscation applied.
 */
@Component
@RequiredArgsConstructor
public class FooterHeaderExtractor implements EmailSourceExtractor {

    private static final String CONTACT_BLOCKS =
            "footer, header, address, [class*=footer], [id*=footer], [class*=contact], [id*=contact]";

    private final TextObfuscationNormalizer obfuscationNormalizer;

    @Override
    public String name() {
        return "footer-header";
    }

    @Override
    public Stream<String> extractCandidates(PageSnapshot page) {
        Stream.Builder<String> builder = Stream.builder();
        for (Element block : page.document().select(CONTACT_BLOCKS)) {
            RegexTextExtractor.scan(obfuscationNormalizer.normalize(block.text())).forEach(builder::add);
        }
        return builder.build();
    }
}
