package com.mike.leadscout.email.verify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mike.leadscout.config.EmailProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Hashtable;
import java.util.List;

@Component
@Slf4j
public class JndiDnsMxLookup implements MxLookUp {

    private record MxRecords(MxStatus status, List<String> hosts) {
    }

    private record Preference(int preference, String host) {
    }

    private final long mxTimeoutMs;

    private final Cache<String, MxRecords> answers = Caffeine.newBuilder()
            .maximumSize(5_000)
            .expireAfterWrite(Duration.ofMinutes(30))
            .build();

    public JndiDnsMxLookup(EmailProperties props) {
        this.mxTimeoutMs = props.mxTimeoutMs() > 0 ? props.mxTimeoutMs() : 2000;
    }

    @Override
    public MxStatus checkDomain(String domain) {
        return lookup(domain).status();
    }

    @Override
    public List<String> mxHosts(String domain) {
        return lookup(domain).hosts();
    }

    private MxRecords lookup(String domain) {
        if (domain == null || domain.isBlank()) return new MxRecords(MxStatus.INVALID, List.of());

        MxRecords cached = answers.getIfPresent(domain);
        if (cached != null) return cached;

        MxRecords fresh = query(domain);
        if (fresh.status() != MxStatus.UNKNOWN) {
            answers.put(domain, fresh);
        }
        return fresh;
    }

    private MxRecords query(String domain) {
        DirContext ctx = null;
        try {
            Hashtable<String, String> env = new Hashtable<>();
            env.put("java.naming.factory.initial", "com.sun.jndi.dns.DnsContextFactory");
            env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(mxTimeoutMs));
            env.put("com.sun.jndi.dns.timeout.retries", "1");

            ctx = new InitialDirContext(env);
            Attributes attrs = ctx.getAttributes(domain, new String[]{"MX"});
            Attribute attr = attrs.get("MX");

            if (attr == null || attr.size() == 0) {
                return new MxRecords(MxStatus.INVALID, List.of());
            }

            List<Preference> records = new ArrayList<>();
            NamingEnumeration<?> values = attr.getAll();
            while (values.hasMore()) {
                Preference p = parse(String.valueOf(values.next()));
                if (p != null) records.add(p);
            }
            records.sort(Comparator.comparingInt(Preference::preference));
            List<String> hosts = records.stream().map(Preference::host).toList();
            return new MxRecords(hosts.isEmpty() ? MxStatus.INVALID : MxStatus.VALID, hosts);
        } catch (NameNotFoundException e) {
            return new MxRecords(MxStatus.INVALID, List.of());
        } catch (NamingException e) {
            log.debug("JndiDnsMxLookup: MX lookup for {} failed: {}", domain, e.getMessage());
            return new MxRecords(MxStatus.UNKNOWN, List.of());
        } finally {
            closeQuietly(ctx);
        }
    }

    /**
     * "10 mx1.example.com." -> (10, mx1.example.com)
     */
    static Preference parse(String record) {
        String[] parts = record.trim().split("\\s+");
        if (parts.length != 2) return null;
        try {
            String host = parts[1].endsWith(".") ? parts[1].substring(0, parts[1].length() - 1) : parts[1];
            if (host.isEmpty()) return null;
            return new Preference(Integer.parseInt(parts[0]), host);
        } catch (NumberFormatException e) {
            log.debug("JndiDnsMxLookup: unparseable MX record '{}'", record);
            return null;
        }
    }

    private static void closeQuietly(DirContext ctx) {
        if (ctx == null) return;
        try {
            ctx.close();
        } catch (NamingException e) {
            log.debug("JndiDnsMxLookup: context close failed: {}", e.getMessage());
        }
    }
}
