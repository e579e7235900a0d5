package com.resource.naming.rules;

import com.resource.naming.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads every {@code *.json} file of a directory (or a single file) as a rule layer.
 */
public class DirectoryRuleSource implements RuleSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryRuleSource.class);

    private final Path path;
    private final RuleLayerParser parser;

    public DirectoryRuleSource(Path path) {
        this(path, new RuleLayerParser());
    }

    public DirectoryRuleSource(Path path, RuleLayerParser parser) {
        this.path = path;
        this.parser = parser;
    }

    @Override
    public List<RuleLayer> load() {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Naming rules path '" + path + "' does not exist");
        }
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(path)) {
            try (Stream<Path> stream = Files.list(path)) {
                stream.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".json"))
                        .sorted()
                        .forEach(files::add);
            } catch (IOException e) {
                throw new ConfigurationException("Unable to list naming rules under '" + path + "'", e);
            }
        } else {
            files.add(path);
        }

        List<RuleLayer> layers = new ArrayList<>();
        for (Path file : files) {
            try {
                String json = Files.readString(file, StandardCharsets.UTF_8);
                layers.add(parser.parse(file.getFileName().toString(), json));
            } catch (IOException e) {
                throw new ConfigurationException("Unable to read rule layer '" + file.getFileName() + "'", e);
            }
        }
        log.debug("rules.source.loaded path={} layers={}", path, layers.size());
        return layers;
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
