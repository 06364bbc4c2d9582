package org.fpbjs.amlmapper;

import org.fpbjs.amlmapper.aml.AmlXmlHelper;
import org.fpbjs.amlmapper.fpb.FpbJsonHelper;
import org.fpbjs.amlmapper.fpb.models.FpbDocument;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Loads the documents under src/test/resources/fixtures.
 */
public final class Fixtures {
    public static final Instant FIXED_INSTANT = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FpbDocument fpbDocument(String name) {
        return FpbJsonHelper.readDocument(FpbJsonHelper.parse(read(name)));
    }

    public static Document amlDocument(String name) {
        return AmlXmlHelper.parse(read(name));
    }

    public static Clock fixedClock() {
        return Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC);
    }
}
