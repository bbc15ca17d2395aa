package com.dimosr.opentsdb.util;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Provides the short name of the local host, which is the host name without its domain
 * (e.g. "host1" for "host1.example.com")
 *
 * The host name is looked up lazily on first use and then cached for the lifetime of the instance.
 */
public class ShortHostname implements Supplier<String> {
    private static final Logger log = LoggerFactory.getLogger(ShortHostname.class);

    static final String UNKNOWN_HOST = "unknown";

    private final Supplier<String> shortHostname;

    public ShortHostname() {
        this(ShortHostname::lookupLocalHostname);
    }

    /**
     * @param hostnameLookup the lookup providing the full host name, which will be called at most once
     */
    public ShortHostname(final Supplier<String> hostnameLookup) {
        this.shortHostname = Suppliers.memoize(() -> shorten(hostnameLookup.get()));
    }

    @Override
    public String get() {
        return shortHostname.get();
    }

    static String shorten(final String hostname) {
        int index = hostname.indexOf('.');
        if(index > 0) {
            return hostname.substring(0, index);
        }
        return hostname;
    }

    private static String lookupLocalHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve the local host name, metrics will be reported with host={}", UNKNOWN_HOST, e);
            return UNKNOWN_HOST;
        }
    }
}
