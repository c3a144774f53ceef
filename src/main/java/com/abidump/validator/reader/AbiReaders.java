package com.abidump.validator.reader;

import java.util.Iterator;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates an {@link AbiReader} registered under {@code META-INF/services}.
 */
public final class AbiReaders {
    private static final Logger log = LoggerFactory.getLogger(AbiReaders.class);

    private AbiReaders() {
        // Utility class
    }

    public static AbiReader load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static AbiReader load(ClassLoader classLoader) {
        Iterator<AbiReader> readers = ServiceLoader.load(AbiReader.class, classLoader).iterator();
        if (!readers.hasNext()) {
            throw new IllegalStateException("No ABI reader is available. Put an implementation of "
                    + AbiReader.class.getName() + " registered in META-INF/services on the class path.");
        }
        AbiReader reader = readers.next();
        log.debug("Using ABI reader '{}' ({})", reader.getName(), reader.getClass().getName());
        return reader;
    }
}
