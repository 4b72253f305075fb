package pl.marcinmilkowski.qgram.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.qgram.alphabet.Alphabet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads named alphabet presets from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "alphabets": [
 *     {
 *       "name": "dna",
 *       "description": "Unambiguous nucleotides",
 *       "symbols": "ACGT",
 *       "case_insensitive": false
 *     },
 *     ...
 *   ]
 * }
 *
 * With "case_insensitive" the other case of every letter is added to the
 * alphabet as a symbol of its own (and so gets a rank of its own).
 */
public class AlphabetConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(AlphabetConfigLoader.class);

    /** Classpath resource holding the bundled presets. */
    public static final String DEFAULT_RESOURCE = "alphabets.json";

    private final String version;
    private final String source;
    private final List<AlphabetConfig> alphabets;
    private final Map<String, AlphabetConfig> alphabetsByName;

    /**
     * Load alphabet presets from the specified path.
     *
     * @param configPath Path to the alphabets JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public AlphabetConfigLoader(Path configPath) throws IOException {
        this(readConfig(configPath), configPath.toString());
    }

    private AlphabetConfigLoader(String content, String source) {
        this.source = source;

        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed alphabet config " + source + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty alphabet config: " + source);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in alphabet config");
        }
        this.version = parsedVersion;

        JSONArray alphabetsArray = root.getJSONArray("alphabets");
        if (alphabetsArray == null || alphabetsArray.isEmpty()) {
            throw new IllegalArgumentException("Missing or empty 'alphabets' array in alphabet config");
        }

        List<AlphabetConfig> loaded = new ArrayList<>();
        Map<String, AlphabetConfig> loadedByName = new HashMap<>();
        for (int i = 0; i < alphabetsArray.size(); i++) {
            JSONObject obj = alphabetsArray.getJSONObject(i);
            if (obj == null) {
                throw new IllegalArgumentException("Invalid alphabet at index " + i);
            }

            String name = obj.getString("name");
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Missing 'name' field for alphabet at index " + i);
            }
            String symbols = obj.getString("symbols");
            if (symbols == null || symbols.isEmpty()) {
                throw new IllegalArgumentException("Missing or empty 'symbols' for alphabet '" + name + "'");
            }

            AlphabetConfig config = new AlphabetConfig(
                name.toLowerCase(Locale.ROOT),
                obj.getString("description"),
                symbols,
                obj.getBooleanValue("case_insensitive", false)
            );
            try {
                config.toAlphabet();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid 'symbols' for alphabet '" + name + "': " + e.getMessage(), e);
            }

            if (loadedByName.containsKey(config.name())) {
                throw new IllegalArgumentException("Duplicate alphabet name: " + config.name());
            }
            loaded.add(config);
            loadedByName.put(config.name(), config);
        }
        this.alphabets = Collections.unmodifiableList(loaded);
        this.alphabetsByName = Collections.unmodifiableMap(loadedByName);

        logger.info("Loaded alphabet config version {}: {} alphabets from {}",
            version, alphabets.size(), source);
    }

    private static String readConfig(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Alphabet config file not found: " + configPath);
        }
        return Files.readString(configPath);
    }

    /**
     * Load the presets bundled with the library (dna, dna_n, iupac, protein).
     */
    public static AlphabetConfigLoader createDefault() {
        try (InputStream in = AlphabetConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default alphabet config not on classpath: " + DEFAULT_RESOURCE);
            }
            return new AlphabetConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default alphabet config: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Get an alphabet by name (case-insensitive).
     */
    public Optional<Alphabet> getAlphabet(String name) {
        return getAlphabetConfig(name).map(AlphabetConfig::toAlphabet);
    }

    /**
     * Get an alphabet by name, failing if it is not configured.
     */
    public Alphabet requireAlphabet(String name) {
        return getAlphabet(name).orElseThrow(() -> new IllegalArgumentException(
            "Unknown alphabet '" + name + "', configured: " + getNames()));
    }

    public Optional<AlphabetConfig> getAlphabetConfig(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(alphabetsByName.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Names of all configured alphabets, in file order.
     */
    public List<String> getNames() {
        return alphabets.stream().map(AlphabetConfig::name).toList();
    }

    public List<AlphabetConfig> getAlphabets() {
        return alphabets;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Where the config was loaded from: a file path or {@code classpath:} resource.
     */
    public String getSource() {
        return source;
    }

    /**
     * Export the loaded config as a JSONObject.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        JSONArray alphabetsArray = new JSONArray();
        for (AlphabetConfig a : alphabets) {
            alphabetsArray.add(a.toJson());
        }
        root.put("alphabets", alphabetsArray);
        return root;
    }

    /**
     * Alphabet preset record.
     */
    public record AlphabetConfig(
        String name,
        String description,
        String symbols,
        boolean caseInsensitive
    ) {
        public Alphabet toAlphabet() {
            Alphabet alphabet = Alphabet.of(symbols);
            return caseInsensitive ? alphabet.caseInsensitive() : alphabet;
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("name", name);
            if (description != null) obj.put("description", description);
            obj.put("symbols", symbols);
            obj.put("case_insensitive", caseInsensitive);
            return obj;
        }
    }
}
