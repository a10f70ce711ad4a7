package ai.reanalyze.cache;

import ai.reanalyze.workspace.CompilationUnit;
import ai.reanalyze.workspace.CompiledUnit;
import ai.reanalyze.workspace.UnitCompiler;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Comparator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default {@link UnitCompiler}: the "artifact" is a SHA-256 fingerprint over the unit's documents and
 * declared references. Real compilers plug in behind the same interface.
 */
public class FingerprintUnitCompiler implements UnitCompiler {
    private static final Logger logger = LogManager.getLogger(FingerprintUnitCompiler.class);

    @Override
    public String contentHash(CompilationUnit unit) throws IOException {
        var digest = newDigest();
        digest.update(unit.id().value().getBytes(StandardCharsets.UTF_8));
        for (var ref : unit.references()) {
            digest.update((byte) 0);
            digest.update(ref.value().getBytes(StandardCharsets.UTF_8));
        }
        var documents = unit.documents().stream().sorted(Comparator.comparing(Object::toString)).toList();
        for (var doc : documents) {
            digest.update((byte) 1);
            digest.update(doc.toString().getBytes(StandardCharsets.UTF_8));
            try {
                digest.update(Files.readAllBytes(doc));
            } catch (NoSuchFileException e) {
                // deleted documents still change the fingerprint through their path marker
                logger.trace("Document {} of unit {} no longer exists", doc, unit.id());
                digest.update((byte) 2);
            }
        }
        return toHex(digest.digest());
    }

    @Override
    public CompiledUnit compile(CompilationUnit unit) throws IOException {
        var hash = contentHash(unit);
        logger.debug("Compiled unit {} ({} documents, hash {})", unit.id(), unit.documentCount(), hash.substring(0, 12));
        return new CompiledUnit(unit.id(), hash, unit.documentCount(), Instant.now());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        var sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
