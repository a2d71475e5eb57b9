package io.kneo.messenger.repository;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@ApplicationScoped
public class SchemaRepository {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRepository.class);
    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final PgPool client;

    @Inject
    public SchemaRepository(PgPool client) {
        this.client = client;
    }

    public Uni<Integer> applySchema() {
        List<String> statements = statements(loadScript());
        return Multi.createFrom().iterable(statements)
                .onItem().transformToUniAndConcatenate(sql -> client.query(sql).execute())
                .collect().asList()
                .onItem().transform(results -> {
                    LOGGER.info("Applied {} schema statements from {}", results.size(), SCHEMA_RESOURCE);
                    return results.size();
                });
    }

    static List<String> statements(String script) {
        String withoutComments = Arrays.stream(script.split("\n"))
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        return Arrays.stream(withoutComments.split(";"))
                .map(String::trim)
                .filter(sql -> !sql.isEmpty())
                .collect(Collectors.toList());
    }

    static String loadScript() {
        try (InputStream in = SchemaRepository.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Schema script " + SCHEMA_RESOURCE + " is not on the classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
