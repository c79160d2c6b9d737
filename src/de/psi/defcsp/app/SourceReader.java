package de.psi.defcsp.app;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import edu.mit.csail.sdg.alloy4.ErrorFatal;

/**
 * Reads program text from files, or from standard input for {@code "-"}.
 */
public class SourceReader {
    private final InputStream stdin;

    public SourceReader(InputStream stdin) {
        this.stdin = stdin;
    }

    public SourceReader() {
        this(System.in);
    }

    public String read(String path) throws ErrorFatal {
        try {
            if (path.equals(AppConfig.STDIN)) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                byte[] buf = new byte[8192];
                int n;
                while ((n = stdin.read(buf)) > 0) out.write(buf, 0, n);
                return new String(out.toByteArray(), StandardCharsets.UTF_8);
            }
            return new String(Files.readAllBytes(new File(path).toPath()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ErrorFatal("cannot read " + (path.equals(AppConfig.STDIN) ? "standard input" : path)
                    + ": " + e.getMessage(), e);
        }
    }

    /** Display name used in source locations. */
    public static String displayName(String path) {
        return path.equals(AppConfig.STDIN) ? "<stdin>" : path;
    }
}
