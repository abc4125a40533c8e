package ai.claudian.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliPathResolverTest {

    @TempDir
    Path home;

    @Test
    void platformKeysFollowOsName() {
        assertEquals("macos", Platform.fromOsName("Mac OS X").key());
        assertEquals("windows", Platform.fromOsName("Windows 11").key());
        assertEquals("linux", Platform.fromOsName("Linux").key());
        assertEquals("linux", Platform.fromOsName(null).key());
    }

    @Test
    void hostPathWinsOverLegacyPath() throws Exception {
        Path hostCli = Files.createFile(home.resolve("claude-host"));
        Path legacyCli = Files.createFile(home.resolve("claude-legacy"));
        var resolver = new CliPathResolver("laptop", Platform.LINUX, home);

        var resolved = resolver.resolve(Map.of("laptop", hostCli.toString()), legacyCli.toString());

        assertEquals(hostCli, resolved.orElseThrow());
    }

    @Test
    void otherHostsAreIgnoredAndTildeIsExpanded() throws Exception {
        Files.createDirectories(home.resolve("bin"));
        Path legacyCli = Files.createFile(home.resolve("bin/claude"));
        var resolver = new CliPathResolver("laptop", Platform.LINUX, home);

        var resolved = resolver.resolve(Map.of("desktop", "/nowhere/claude"), "~/bin/claude");

        assertEquals(legacyCli, resolved.orElseThrow());
    }

    @Test
    void missingFilesAndDirectoriesDoNotResolve() {
        var resolver = new CliPathResolver("laptop", Platform.LINUX, home);

        assertTrue(resolver.resolve(Map.of("laptop", home.toString()), "").isEmpty());
    }

    @Test
    void resultIsCachedUntilReset() throws Exception {
        Path cli = home.resolve("claude");
        var resolver = new CliPathResolver("laptop", Platform.LINUX, home);
        Map<String, String> byHost = Map.of("laptop", cli.toString());

        assertTrue(resolver.resolve(byHost, null).isEmpty());
        Files.createFile(cli);
        assertTrue(resolver.resolve(byHost, null).isEmpty(), "cached miss");

        resolver.reset();
        assertEquals(cli, resolver.resolve(byHost, null).orElseThrow());
    }

    @Test
    void detectedHostnameIsNeverBlank() {
        assertFalse(CliPathResolver.detectHostname().isBlank());
    }
}
