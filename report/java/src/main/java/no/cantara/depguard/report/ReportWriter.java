package no.cantara.depguard.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import no.cantara.depguard.finding.Verdict;
import no.cantara.depguard.policy.Severity;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Serializes report envelopes as pretty-printed JSON with snake_case keys.
 *
 * <p>Absent optional fields are omitted, timestamps are ISO-8601 instants and
 * enum values are lower-case tokens ({@code "error"}, {@code "fail"}).
 */
public final class ReportWriter {

    private static final ObjectMapper MAPPER = createMapper();

    private ReportWriter() {}

    static ObjectMapper createMapper() {
        SimpleModule tokens = new SimpleModule("depguard-tokens");
        tokens.addSerializer(Severity.class, new LowerCaseEnumSerializer<>(Severity.class));
        tokens.addSerializer(Verdict.class, new LowerCaseEnumSerializer<>(Verdict.class));

        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(tokens)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** The mapper used for reports; shared, configured once. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(ReportEnvelope envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (IOException e) {
            throw new UncheckedIOException("serialize report", e);
        }
    }

    public static void write(ReportEnvelope envelope, OutputStream out) throws IOException {
        MAPPER.writeValue(out, envelope);
    }

    /** Writes the report to {@code path}, creating parent directories as needed. */
    public static void write(ReportEnvelope envelope, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), envelope);
    }

    private static final class LowerCaseEnumSerializer<E extends Enum<E>> extends StdSerializer<E> {

        LowerCaseEnumSerializer(Class<E> type) {
            super(type);
        }

        @Override
        public void serialize(E value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.name().toLowerCase(Locale.ROOT));
        }
    }
}
