package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Versioned template migrations bundled on the classpath. A file is picked up
 * only when its name starts with a 14 digit timestamp version.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationCatalog {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^(\\d{14})_.*\\.sql$");

    private final LaunchpadProperties properties;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    /** All migrations, oldest first. */
    public List<Migration> list() {
        String location = properties.getDatabase().getMigrationsLocation();
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            log.warn("Could not scan migration location {}: {}", location, e.getMessage());
            return List.of();
        }

        List<Migration> migrations = new ArrayList<>();
        for (Resource resource : resources) {
            String filename = resource.getFilename();
            if (filename == null) {
                continue;
            }
            Matcher matcher = VERSION_PATTERN.matcher(filename);
            if (!matcher.matches()) {
                log.debug("Ignoring unversioned file {}", filename);
                continue;
            }
            migrations.add(new Migration(matcher.group(1), filename, resource));
        }
        migrations.sort(Comparator.comparing(Migration::getFilename));
        return migrations;
    }

    /** Version of the newest migration, or null when none is bundled. */
    public String latestVersion() {
        List<Migration> all = list();
        return all.isEmpty() ? null : all.get(all.size() - 1).getVersion();
    }

    /**
     * Migrations strictly newer than {@code version}. A null version means the
     * tenant never recorded one, so everything is returned.
     */
    public List<Migration> migrationsSince(String version) {
        List<Migration> all = list();
        if (version == null) {
            return all;
        }
        return all.stream()
            .filter(m -> m.getVersion().compareTo(version) > 0)
            .toList();
    }

    @Data
    @AllArgsConstructor
    public static class Migration {
        private String version;
        private String filename;
        private Resource resource;

        public String readSql() {
            try {
                return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read migration " + filename, e);
            }
        }
    }
}
