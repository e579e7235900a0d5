package com.resource.naming.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resource.naming.error.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads rule layers bundled on the classpath. The directory carries an {@code index.json}
 * array naming its layer files, since classpath directories cannot be listed portably.
 */
public class ClasspathRuleSource implements RuleSource {

    public static final String DEFAULT_DIRECTORY = "rules";

    private final String directory;
    private final ClassLoader classLoader;
    private final RuleLayerParser parser;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ClasspathRuleSource() {
        this(DEFAULT_DIRECTORY);
    }

    public ClasspathRuleSource(String directory) {
        this(directory, ClasspathRuleSource.class.getClassLoader(), new RuleLayerParser());
    }

    public ClasspathRuleSource(String directory, ClassLoader classLoader, RuleLayerParser parser) {
        this.directory = directory.endsWith("/") ? directory.substring(0, directory.length() - 1) : directory;
        this.classLoader = classLoader;
        this.parser = parser;
    }

    @Override
    public List<RuleLayer> load() {
        String[] files;
        try {
            files = objectMapper.readValue(read(directory + "/index.json"), String[].class);
        } catch (IOException e) {
            throw new ConfigurationException("Rule index '" + directory + "/index.json' is not a JSON array of file names", e);
        }
        List<RuleLayer> layers = new ArrayList<>();
        for (String file : files) {
            layers.add(parser.parse(file, read(directory + "/" + file)));
        }
        return layers;
    }

    private String read(String resource) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Classpath resource '" + resource + "' not found");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read classpath resource '" + resource + "'", e);
        }
    }

    @Override
    public String describe() {
        return "classpath:" + directory;
    }
}
