package pl.marcinmilkowski.qgram.config;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.qgram.alphabet.Alphabet;
import pl.marcinmilkowski.qgram.indexer.QGramIndex;
import pl.marcinmilkowski.qgram.query.ExactMatch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlphabetConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String json) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, json);
        return path;
    }

    @Test
    @DisplayName("Loads presets from a file, names case-insensitive")
    void loadsTestConfig() throws IOException {
        AlphabetConfigLoader config = new AlphabetConfigLoader(Paths.get("src/test/resources/test-alphabets.json"));

        assertEquals("test-1", config.getVersion());
        assertEquals(List.of("binary", "dna"), config.getNames());
        assertTrue(config.getSource().endsWith("test-alphabets.json"));

        assertEquals(Alphabet.of("01"), config.requireAlphabet("binary"));

        Alphabet soft = config.requireAlphabet("DNA");
        assertEquals(8, soft.len());
        assertTrue(soft.isWord("acgtACGT".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("Soft-masked nucleotides", config.getAlphabetConfig("dna").orElseThrow().description());

        assertTrue(config.getAlphabet("protein").isEmpty());
        assertTrue(config.getAlphabet(null).isEmpty());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> config.requireAlphabet("protein"));
        assertTrue(e.getMessage().contains("protein"));
    }

    @Test
    @DisplayName("Bundled presets cover nucleotides and amino acids")
    void loadsDefault() {
        AlphabetConfigLoader config = AlphabetConfigLoader.createDefault();

        assertEquals("1.0", config.getVersion());
        assertEquals(List.of("dna", "dna_n", "iupac", "protein"), config.getNames());
        assertEquals("classpath:alphabets.json", config.getSource());
        assertEquals(4, config.requireAlphabet("dna").len());
        assertEquals(5, config.requireAlphabet("dna_n").len());
        assertEquals(16, config.requireAlphabet("iupac").len());
        assertEquals(20, config.requireAlphabet("protein").len());
    }

    @Test
    @DisplayName("Preset alphabet drives an index end to end")
    void presetBuildsIndex() {
        Alphabet protein = AlphabetConfigLoader.createDefault().requireAlphabet("protein");
        byte[] text = "MKTAYIAKQRQISFVKSHFSRQ".getBytes(StandardCharsets.US_ASCII);
        QGramIndex index = QGramIndex.build(3, text, protein);

        List<ExactMatch> matches = index.exactMatches("AKQRQIS".getBytes(StandardCharsets.US_ASCII));
        assertEquals(List.of(new ExactMatch(0, 7, 6, 13)), matches);
    }

    @Test
    @DisplayName("toJson() exports every preset")
    void exportsJson() {
        JSONObject json = AlphabetConfigLoader.createDefault().toJson();
        assertEquals("1.0", json.getString("version"));
        assertEquals(4, json.getJSONArray("alphabets").size());
        assertEquals("ACGT", json.getJSONArray("alphabets").getJSONObject(0).getString("symbols"));
    }

    @Test
    @DisplayName("Missing file fails with IOException")
    void missingFile() {
        IOException e = assertThrows(IOException.class,
            () -> new AlphabetConfigLoader(tempDir.resolve("nope.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("Invalid configs are rejected")
    void invalidConfigs() throws IOException {
        Path noVersion = write("no-version.json", "{\"alphabets\": [{\"name\": \"a\", \"symbols\": \"AB\"}]}");
        assertThrows(IllegalArgumentException.class, () -> new AlphabetConfigLoader(noVersion));

        Path noAlphabets = write("no-alphabets.json", "{\"version\": \"1\", \"alphabets\": []}");
        assertThrows(IllegalArgumentException.class, () -> new AlphabetConfigLoader(noAlphabets));

        Path noSymbols = write("no-symbols.json", "{\"version\": \"1\", \"alphabets\": [{\"name\": \"a\"}]}");
        assertThrows(IllegalArgumentException.class, () -> new AlphabetConfigLoader(noSymbols));

        Path duplicate = write("duplicate.json", "{\"version\": \"1\", \"alphabets\": ["
            + "{\"name\": \"dna\", \"symbols\": \"ACGT\"}, {\"name\": \"DNA\", \"symbols\": \"ACGU\"}]}");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new AlphabetConfigLoader(duplicate));
        assertTrue(e.getMessage().contains("Duplicate"));

        Path malformed = write("malformed.json", "{\"version\": \"1\", \"alphabets\": [");
        assertThrows(IllegalArgumentException.class, () -> new AlphabetConfigLoader(malformed));

        Path wide = write("wide.json", "{\"version\": \"1\", \"alphabets\": ["
            + "{\"name\": \"pl\", \"symbols\": \"AC\u0141\"}]}");
        IllegalArgumentException w = assertThrows(IllegalArgumentException.class,
            () -> new AlphabetConfigLoader(wide));
        assertTrue(w.getMessage().contains("'pl'"), w.getMessage());
    }
}
