package lls.proc.service.compression;

import lls.proc.exceptions.CompressionException;
import lls.proc.exceptions.PathTraversalException;
import lls.proc.utilities.MinorFunctions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SubprocessCompressionServiceTest {

    @TempDir
    Path dataset;

    // ==================== Archive entry validation ====================

    @Test
    void testValidateEntries_InsideTarget() {
        assertDoesNotThrow(() -> SubprocessCompressionService.validateEntries(
                List.of("cell1_ch0_stack0000.tif", "sub/cell1_ch0_stack0001.tif", "./x.tif", "sub/../y.tif"),
                dataset));
    }

    @ParameterizedTest
    @ValueSource(strings = {"../evil.tif", "sub/../../evil.tif", "/etc/passwd"})
    void testValidateEntries_TraversalRejected(String entry) {
        PathTraversalException e = assertThrows(PathTraversalException.class,
                () -> SubprocessCompressionService.validateEntries(List.of("ok.tif", entry), dataset));
        assertEquals(entry, e.getEntry());
    }

    @Test
    void testValidateEntries_SiblingWithSharedPrefixRejected() {
        String sibling = "../" + dataset.getFileName() + "_other/file.tif";
        assertThrows(PathTraversalException.class,
                () -> SubprocessCompressionService.validateEntries(List.of(sibling), dataset));
    }

    // ==================== Detection & refusal ====================

    @Test
    void testIsCompressed() throws Exception {
        SubprocessCompressionService service = new SubprocessCompressionService("tar", "gzip");
        assertFalse(service.isCompressed(dataset));
        Files.createFile(dataset.resolve("cell1_ch0_stack0000.tif"));
        assertFalse(service.isCompressed(dataset));
        Files.createFile(dataset.resolve("cell1.tar.bz2"));
        assertTrue(service.isCompressed(dataset));
    }

    @Test
    void testIsCompressed_MissingFolder() {
        assertFalse(new SubprocessCompressionService().isCompressed(dataset.resolve("absent")));
    }

    @Test
    void testCompress_RefusesWhenArchiveExists() throws Exception {
        Files.createFile(dataset.resolve("cell1_ch0_stack0000.tif"));
        Files.createFile(dataset.resolve("cell1.tar.gz"));
        SubprocessCompressionService service = new SubprocessCompressionService("tar", "gzip");

        CompressionException e = assertThrows(CompressionException.class, () -> service.compress(dataset));
        assertTrue(e.getMessage().contains("both raw tiffs and a compressed file"));
        assertTrue(Files.exists(dataset.resolve("cell1_ch0_stack0000.tif")));
    }

    @Test
    void testCompress_NothingToCompress() {
        SubprocessCompressionService service = new SubprocessCompressionService("tar", "gzip");
        assertThrows(CompressionException.class, () -> service.compress(dataset));
    }

    @Test
    void testDecompress_NoArchive() {
        SubprocessCompressionService service = new SubprocessCompressionService("tar", "gzip");
        assertThrows(CompressionException.class, () -> service.decompress(dataset));
    }

    // ==================== External tools ====================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testCompressThenDecompressRestoresTiffs() throws Exception {
        assumeTrue(MinorFunctions.which("tar").isPresent(), "tar not installed");
        assumeTrue(MinorFunctions.which("gzip").isPresent(), "gzip not installed");
        Path folder = Files.createDirectory(dataset.resolve("cell1"));
        Files.writeString(folder.resolve("cell1_ch0_stack0000.tif"), "stack 0");
        Files.writeString(folder.resolve("cell1_ch0_stack0001.tif"), "stack 1");
        Files.writeString(folder.resolve("cell1_Settings.txt"), "settings");
        SubprocessCompressionService service = new SubprocessCompressionService("tar", "gzip");

        service.compress(folder);

        assertTrue(Files.isRegularFile(folder.resolve("cell1.tar.gz")));
        assertFalse(Files.exists(folder.resolve("cell1_ch0_stack0000.tif")));
        assertTrue(Files.exists(folder.resolve("cell1_Settings.txt")), "only tiffs are archived");
        assertTrue(service.isCompressed(folder));

        service.decompress(folder);

        assertEquals("stack 1", Files.readString(folder.resolve("cell1_ch0_stack0001.tif")));
        assertFalse(service.isCompressed(folder));
    }
}
