package work.lcod.installer.runtime;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a finished script in one step: bytes go to a temporary file next to the target which is
 * then moved into place, so a failed write never leaves a partial script behind.
 */
public final class ScriptWriter {
    private static final Logger log = LoggerFactory.getLogger(ScriptWriter.class);
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private ScriptWriter() {}

    public static byte[] encode(String script, boolean byteOrderMark) {
        var body = script.getBytes(StandardCharsets.UTF_8);
        if (!byteOrderMark) {
            return body;
        }
        var bytes = new byte[UTF8_BOM.length + body.length];
        System.arraycopy(UTF8_BOM, 0, bytes, 0, UTF8_BOM.length);
        System.arraycopy(body, 0, bytes, UTF8_BOM.length, body.length);
        return bytes;
    }

    public static long write(Path target, String script, boolean byteOrderMark) {
        var absolute = target.toAbsolutePath().normalize();
        var bytes = encode(script, byteOrderMark);
        Path temp = null;
        try {
            var parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                out.write(bytes);
            }
            move(temp, absolute);
            temp = null;
            log.info("Wrote {} ({} bytes)", absolute, bytes.length);
            return bytes.length;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write script: " + absolute, ex);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Could not remove temporary file {}: {}", temp, ex.getMessage());
        }
    }
}
