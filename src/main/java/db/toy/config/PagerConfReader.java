package db.toy.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.toy.pager.PagerConf;

/**
 * Loads and saves {@link PagerConf} as JSON:
 * <pre>{"filePath": "data/toy.db", "pageSize": 4096, "baseOffset": 128, "pagesNumber": 0}</pre>
 * Fields left out take their value from {@link PagerConf#defaults(String)}.
 */
public final class PagerConfReader {
    private static final Logger LOG = LoggerFactory.getLogger(PagerConfReader.class);

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    public PagerConf read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    public PagerConf fromJson(String json) {
        return read(new StringReader(json), "<string>");
    }

    public void write(PagerConf conf, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(ConfFile.of(conf), writer);
        }
        LOG.debug("Saved pager configuration to {}", path);
    }

    private PagerConf read(Reader reader, String source) {
        ConfFile file;
        try {
            file = gson.fromJson(reader, ConfFile.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed pager configuration in " + source + ": " + e.getMessage(), e);
        }
        if (file == null) {
            throw new IllegalArgumentException("Empty pager configuration in " + source);
        }
        try {
            PagerConf conf = file.toConf();
            LOG.debug("Loaded pager configuration from {}: {}", source, conf);
            return conf;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid pager configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    // JSON shape; boxed so absent fields stay null
    private static final class ConfFile {
        String filePath;
        Integer pageSize;
        Long baseOffset;
        Long pagesNumber;

        static ConfFile of(PagerConf conf) {
            ConfFile f = new ConfFile();
            f.filePath = conf.filePath();
            f.pageSize = conf.pageSize();
            f.baseOffset = conf.baseOffset();
            f.pagesNumber = conf.pagesNumber();
            return f;
        }

        PagerConf toConf() {
            PagerConf d = PagerConf.defaults(filePath == null ? "" : filePath);
            return new PagerConf(
                    d.filePath(),
                    pageSize != null ? pageSize : d.pageSize(),
                    baseOffset != null ? baseOffset : d.baseOffset(),
                    pagesNumber != null ? pagesNumber : d.pagesNumber());
        }
    }
}
