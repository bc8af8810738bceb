package com.myorg.relay.kafka.discovery;

import com.myorg.relay.contracts.core.exception.BrokerDiscoveryException;
import lombok.extern.slf4j.Slf4j;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;

//SRV lookup through the JDK's JNDI DNS provider, using the resolvers the host is configured with.
@Slf4j
public class JndiSrvLookup implements SrvLookup {

    private final Duration timeout;

    public JndiSrvLookup(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public List<SrvRecord> lookup(String service, String domain) {
        String name = "_" + service + "._tcp." + domain;

        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.dns.DnsContextFactory");
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(Math.max(1, timeout.toMillis())));
        env.put("com.sun.jndi.dns.timeout.retries", "1");

        DirContext ctx = null;
        try {
            ctx = new InitialDirContext(env);
            Attributes attrs = ctx.getAttributes(name, new String[]{"SRV"});
            Attribute srv = attrs.get("SRV");
            if (srv == null) return List.of();

            List<SrvRecord> records = new ArrayList<>();
            NamingEnumeration<?> values = srv.getAll();
            while (values.hasMore()) {
                records.add(parse(String.valueOf(values.next()), service));
            }
            records.sort(SrvRecord.PREFERRED_FIRST);
            log.debug("SRV {} -> {}", name, records);
            return records;
        } catch (NameNotFoundException e) {
            return List.of();
        } catch (NamingException e) {
            throw new BrokerDiscoveryException(service, "SRV lookup of " + name + " failed: " + e.getMessage(), e);
        } finally {
            if (ctx != null) {
                try {
                    ctx.close();
                } catch (NamingException e) {
                    log.debug("Failed to close DNS context: {}", e.toString());
                }
            }
        }
    }

    // "priority weight port target"
    static SrvRecord parse(String value, String service) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 4) {
            throw new BrokerDiscoveryException(service, "Malformed SRV record: '" + value + "'");
        }
        try {
            return new SrvRecord(
                    Integer.parseInt(parts[0]),
                    Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2]),
                    parts[3]
            );
        } catch (NumberFormatException e) {
            throw new BrokerDiscoveryException(service, "Malformed SRV record: '" + value + "'", e);
        }
    }
}
