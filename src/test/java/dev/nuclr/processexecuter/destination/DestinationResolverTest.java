package dev.nuclr.processexecuter.destination;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import dev.nuclr.processexecuter.CountingOutputStream;
import dev.nuclr.processexecuter.FailingOutputStream;
import dev.nuclr.processexecuter.config.ProcessExecuterConfig;
import dev.nuclr.processexecuter.pipe.MonitoredPipe;

/**
 * Tests for {@link DestinationResolver} and the destinations it produces.
 */
class DestinationResolverTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private DestinationResolver resolver;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        resolver = new DestinationResolver(
                new ProcessExecuterConfig(), new StandardStreams(stdout, stderr));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // -------------------------------------------------------------------------
    // typeOf

    @Test
    void typeOfRecognisesEveryRedirectionForm() throws IOException {
        String file = tempDir.resolve("f").toString();

        assertEquals(DestinationType.CLOSE, resolver.typeOf(Redirection.CLOSE));
        assertEquals(DestinationType.CHILD_REDIRECTION, resolver.typeOf(Redirection.child(1)));
        assertEquals(DestinationType.TEE, resolver.typeOf(Redirection.tee(stdout)));
        assertEquals(DestinationType.STDOUT, resolver.typeOf(Redirection.OUT));
        assertEquals(DestinationType.STDERR, resolver.typeOf(Redirection.ERR));
        assertEquals(DestinationType.FILE_DESCRIPTOR, resolver.typeOf(7));
        assertEquals(DestinationType.FILE_DESCRIPTOR, resolver.typeOf(0));
        assertEquals(DestinationType.FILE_PATH_MODE_PERMS, resolver.typeOf(Redirection.file(file, "w", 0600)));
        assertEquals(DestinationType.FILE_PATH_MODE, resolver.typeOf(Redirection.file(file, "a")));
        assertEquals(DestinationType.FILE_PATH, resolver.typeOf(file));
        assertEquals(DestinationType.FILE_PATH, resolver.typeOf(Path.of(file)));
        assertEquals(DestinationType.WRITER, resolver.typeOf(stdout));

        try (FileOutputStream fos = new FileOutputStream(file)) {
            assertEquals(DestinationType.FILE_STREAM, resolver.typeOf(fos),
                    "A FileOutputStream must be matched before the generic writer");
        }

        MonitoredPipe pipe = new MonitoredPipe(new ByteArrayOutputStream());
        try {
            assertEquals(DestinationType.MONITORED_PIPE, resolver.typeOf(pipe));
        } finally {
            pipe.close();
        }
    }

    @Test
    void standardStreamIntegersWinOverFileDescriptors() {
        assertEquals(DestinationType.STDOUT, resolver.typeOf(1));
        assertEquals(DestinationType.STDERR, resolver.typeOf(2));
        assertTrue(DestinationType.FILE_DESCRIPTOR.handles(3));
        assertFalse(DestinationType.FILE_DESCRIPTOR.handles(1));
    }

    @Test
    void handBuiltTaggedListsAreRecognised() {
        assertEquals(DestinationType.TEE,
                resolver.typeOf(List.of(Redirection.TEE, Redirection.OUT, 5)));
        assertEquals(DestinationType.CHILD_REDIRECTION,
                resolver.typeOf(List.of(Redirection.CHILD, 2)));
    }

    @Test
    void unsupportedValuesAreRejected() {
        for (Object value : List.of(new Object(), -1, List.of(Redirection.TEE), 1.5, List.of())) {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> resolver.typeOf(value), "Expected rejection of " + value);
            assertTrue(e.getMessage().startsWith("wrong exec redirect action: "), e.getMessage());
        }
        assertThrows(IllegalArgumentException.class, () -> resolver.typeOf(null));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(List.of("x", 42)));
    }

    @Test
    void rejectionMessageDoesNotRenderStreamContents() {
        ByteArrayOutputStream secret = new ByteArrayOutputStream();
        secret.writeBytes(bytes("do-not-print"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> resolver.typeOf(List.of(secret, secret, secret, secret)));
        assertFalse(e.getMessage().contains("do-not-print"), e.getMessage());
    }

    // -------------------------------------------------------------------------
    // compatibility

    @Test
    void onlySpawnTimeRedirectionsAreIncompatibleWithMonitoredPipe() {
        for (DestinationType type : DestinationType.values()) {
            boolean spawnOnly = type == DestinationType.CLOSE || type == DestinationType.CHILD_REDIRECTION;
            assertEquals(!spawnOnly, type.isCompatibleWithMonitoredPipe(), type.name());
        }
        assertFalse(resolver.isCompatibleWithMonitoredPipe(Redirection.CLOSE));
        assertFalse(resolver.isCompatibleWithMonitoredPipe(Redirection.child(2)));
        assertTrue(resolver.isCompatibleWithMonitoredPipe(Redirection.tee(stdout, Redirection.ERR)));
    }

    @Test
    void spawnOnlyDestinationsRefuseBytes() throws IOException {
        Destination close = resolver.resolve(Redirection.CLOSE);
        Destination child = resolver.resolve(Redirection.child(1));

        assertFalse(close.isCompatibleWithMonitoredPipe());
        assertEquals(1, ((ChildRedirectionDestination) child).getFileDescriptor());
        IOException e = assertThrows(IOException.class, () -> close.write(bytes("x")));
        assertTrue(e.getMessage().contains("cannot be written to"), e.getMessage());
        assertThrows(IOException.class, () -> child.write(bytes("x")));
    }

    // -------------------------------------------------------------------------
    // standard streams and writers

    @Test
    void standardStreamsAreWrittenButNeverClosed() throws IOException {
        CountingOutputStream out = new CountingOutputStream();
        CountingOutputStream err = new CountingOutputStream();
        DestinationResolver counting = new DestinationResolver(
                new ProcessExecuterConfig(), new StandardStreams(out, err));

        for (Object value : List.of(Redirection.OUT, 1, Redirection.ERR, 2)) {
            Destination d = counting.resolve(value);
            assertEquals(3, d.write(bytes("abc")));
            d.close();
        }

        assertEquals(6, out.getCount());
        assertEquals(6, err.getCount());
        assertFalse(out.isClosed(), "stdout must never be closed");
        assertFalse(err.isClosed(), "stderr must never be closed");
    }

    @Test
    void writerDestinationLeavesTheStreamOpen() throws IOException {
        CountingOutputStream stream = new CountingOutputStream();
        Destination d = resolver.resolve(stream);

        d.write(bytes("hello"));
        d.close();

        assertSame(stream, d.getDestination());
        assertEquals(5, stream.getCount());
        assertFalse(stream.isClosed());
    }

    @Test
    void fileStreamDestinationDoesNotCloseTheCallersStream() throws IOException {
        Path file = tempDir.resolve("stream.txt");
        try (FileOutputStream fos = new FileOutputStream(file.toFile())) {
            Destination d = resolver.resolve(fos);
            d.write(bytes("via stream"));
            d.close();
            fos.write(bytes("!"));
        }
        assertEquals("via stream!", Files.readString(file));
    }

    // -------------------------------------------------------------------------
    // files

    @Test
    void filePathTruncatesAndClosesItsFile() throws IOException {
        Path file = tempDir.resolve("out.txt");
        Files.writeString(file, "previous content");

        AbstractFileDestination d = (AbstractFileDestination) resolver.resolve(file.toString());
        d.write(bytes("new"));
        d.close();

        assertEquals(file, d.getPath());
        assertTrue(d.isClosed());
        assertEquals("new", Files.readString(file));
        IOException e = assertThrows(IOException.class, () -> d.write(bytes("late")));
        assertEquals("closed stream", e.getMessage());
        assertDoesNotThrow(d::close, "Closing twice is harmless");
    }

    @Test
    void appendModeKeepsExistingContent() throws IOException {
        Path file = tempDir.resolve("log.txt");
        Files.writeString(file, "one\n");

        try (Destination d = resolver.resolve(Redirection.file(file, "a"))) {
            d.write(bytes("two\n"));
        }
        assertEquals("one\ntwo\n", Files.readString(file));
    }

    @Test
    void readPlusModeOverwritesInPlace() throws IOException {
        Path file = tempDir.resolve("rw.txt");
        Files.writeString(file, "abcdef");

        try (Destination d = resolver.resolve(Redirection.file(file, "r+"))) {
            d.write(bytes("XY"));
        }
        assertEquals("XYcdef", Files.readString(file));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void explicitPermissionsApplyToCreatedFile() throws IOException {
        Path file = tempDir.resolve("secret.txt");

        try (Destination d = resolver.resolve(Redirection.file(file.toString(), "w", 0600))) {
            d.write(bytes("s"));
        }
        assertEquals(PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void existingFileKeepsItsPermissions() throws IOException {
        Path file = tempDir.resolve("existing.txt");
        Files.writeString(file, "x");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-rw----"));

        try (Destination d = resolver.resolve(Redirection.file(file, "w", 0600))) {
            d.write(bytes("y"));
        }
        assertEquals(PosixFilePermissions.fromString("rw-rw----"), Files.getPosixFilePermissions(file));
    }

    @Test
    void readOnlyModeIsRejected() {
        Path file = tempDir.resolve("ro.txt");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(Redirection.file(file, "r")));
        assertTrue(e.getMessage().contains("does not allow writing"), e.getMessage());
        assertFalse(Files.exists(file), "Nothing may be created for a rejected mode");
    }

    @Test
    void missingParentDirectoryFailsAtResolve() {
        Path file = tempDir.resolve("no/such/dir/out.txt");
        assertThrows(NoSuchFileException.class, () -> resolver.resolve(file));
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void fileDescriptorWritesReachTheOpenFile() throws IOException {
        Path file = tempDir.resolve("fd.txt");
        Files.createFile(file);
        try (FileOutputStream fos = new FileOutputStream(file.toFile(), true)) {
            int fd = findDescriptorOf(file);

            Destination d = resolver.resolve(fd);
            assertInstanceOf(FileDescriptorDestination.class, d);
            assertEquals(fd, ((FileDescriptorDestination) d).getFileDescriptor());
            d.write(bytes("via fd\n"));
            d.close();

            fos.write(bytes("still open\n"));
        }
        assertEquals("via fd\nstill open\n", Files.readString(file));
    }

    private static int findDescriptorOf(Path file) throws IOException {
        Path target = file.toRealPath();
        try (var entries = Files.list(Path.of("/proc/self/fd"))) {
            for (Path entry : (Iterable<Path>) entries::iterator) {
                try {
                    if (Files.readSymbolicLink(entry).equals(target)) {
                        return Integer.parseInt(entry.getFileName().toString());
                    }
                } catch (IOException e) {
                    // descriptor closed while listing
                    continue;
                }
            }
        }
        fail("No descriptor of this process points at " + target);
        return -1;
    }

    // -------------------------------------------------------------------------
    // tee

    @Test
    void nestedTeeReachesEveryLeaf() throws IOException {
        Path file = tempDir.resolve("tee.txt");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        TeeDestination tee = (TeeDestination) resolver.resolve(Redirection.tee(
                Redirection.OUT,
                Redirection.tee(buffer, file.toString()),
                Redirection.ERR));
        tee.write(bytes("fan"));
        tee.close();

        assertEquals(3, tee.getChildDestinations().size());
        assertInstanceOf(TeeDestination.class, tee.getChildDestinations().get(1));
        assertEquals("fan", stdout.toString(StandardCharsets.UTF_8));
        assertEquals("fan", stderr.toString(StandardCharsets.UTF_8));
        assertEquals("fan", buffer.toString(StandardCharsets.UTF_8));
        assertEquals("fan", Files.readString(file));
    }

    @Test
    void teeStopsAtTheFirstFailingChild() throws IOException {
        ByteArrayOutputStream before = new ByteArrayOutputStream();
        FailingOutputStream failing = new FailingOutputStream();
        ByteArrayOutputStream after = new ByteArrayOutputStream();

        Destination tee = resolver.resolve(Redirection.tee(before, failing, after));
        IOException e = assertThrows(IOException.class, () -> tee.write(bytes("x")));

        assertSame(failing.getThrown(), e);
        assertEquals("x", before.toString(StandardCharsets.UTF_8));
        assertEquals(0, after.size());
        tee.close();
    }

    @Test
    void teeClosesOpenedChildrenWhenALaterChildFails() throws IOException {
        Path good = tempDir.resolve("good.txt");
        Path bad = tempDir.resolve("missing/bad.txt");

        assertThrows(IOException.class,
                () -> resolver.resolve(Redirection.tee(good.toString(), bad.toString())));
        assertTrue(Files.exists(good), "The first child was opened before the failure");
    }

    @Test
    void teeCloseClosesEveryFileChild() throws IOException {
        Path first = tempDir.resolve("first.txt");
        Path second = tempDir.resolve("second.txt");

        TeeDestination tee = (TeeDestination) resolver.resolve(
                Redirection.tee(first.toString(), Redirection.file(second, "a")));
        tee.write(bytes("both"));
        tee.close();

        for (Destination child : tee.getChildDestinations()) {
            assertTrue(((AbstractFileDestination) child).isClosed(), child.toString());
        }
        assertEquals("both", Files.readString(first));
        assertEquals("both", Files.readString(second));
    }
}
