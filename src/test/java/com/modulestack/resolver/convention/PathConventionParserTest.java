package com.modulestack.resolver.convention;

import com.modulestack.resolver.model.ModuleIdentity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PathConventionParser.
 */
class PathConventionParserTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseConventionPath() {
        PathConventionParser parser = new PathConventionParser(List.of("/root"));

        Optional<ModuleIdentity> identity = parser.parse("/root/R7.0.2-2.0/modules/mymodule/R1.2-1.0/");

        assertThat(identity).contains(ModuleIdentity.builder()
                .base("R7.0.2-2.0")
                .name("mymodule")
                .tag("R1.2-1.0")
                .build());
    }

    @Test
    void testUnrelatedPathDoesNotMatch() {
        PathConventionParser parser = new PathConventionParser(List.of("/root"));

        assertThat(parser.parse("/root/unrelated/format")).isEmpty();
    }

    @Test
    void testPathBelowTagDoesNotMatch() {
        PathConventionParser parser = new PathConventionParser(List.of("/root"));

        assertThat(parser.parse("/root/R7.0.2-2.0/modules/mymodule/R1.2-1.0/db")).isEmpty();
    }

    @Test
    void testPathUnderUnknownRootDoesNotMatch() {
        PathConventionParser parser = new PathConventionParser(List.of("/root"));

        assertThat(parser.parse("/elsewhere/R7.0.2-2.0/modules/mymodule/R1.2-1.0")).isEmpty();
    }

    @Test
    void testBlankAndNullInputDoNotMatch() {
        PathConventionParser parser = new PathConventionParser();

        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse((String) null)).isEmpty();
        assertThat(parser.parse((Path) null)).isEmpty();
    }

    @Test
    void testSecondDefaultRootIsRecognized() {
        PathConventionParser parser = new PathConventionParser();

        Optional<ModuleIdentity> identity = parser.parse("/reg/g/pcds/epics/R7.0.2-2.0/modules/asyn/R4.39-1.0.1");

        assertThat(identity).isPresent();
        assertThat(identity.get().getName()).isEqualTo("asyn");
        assertThat(identity.get().getTag()).isEqualTo("R4.39-1.0.1");
    }

    @Test
    void testEveryConfiguredRootIsTried() {
        PathConventionParser parser = new PathConventionParser(List.of("/first/epics", "/second/epics"));

        assertThat(parser.getRootPrefixes()).containsExactly("/first/epics", "/second/epics");
        assertThat(parser.parse("/first/epics/R1/modules/calc/R3.7")).isPresent();
        assertThat(parser.parse("/second/epics/R1/modules/calc/R3.7")).isPresent();
        assertThat(parser.parse("/third/epics/R1/modules/calc/R3.7")).isEmpty();
    }

    @Test
    void testRootPrefixWithTrailingSlash() {
        PathConventionParser parser = new PathConventionParser(List.of("/root/"));

        assertThat(parser.parse("/root/R7.0.2-2.0/modules/mymodule/R1.2-1.0")).isPresent();
    }

    @Test
    void testRelativeSegmentsAreNormalized() {
        PathConventionParser parser = new PathConventionParser(List.of("/root"));

        Optional<ModuleIdentity> identity = parser.parse("/root/R7.0.2-2.0/modules/other/../mymodule/R1.2-1.0");

        assertThat(identity).isPresent();
        assertThat(identity.get().getName()).isEqualTo("mymodule");
    }

    @Test
    void testSymlinkIsResolvedBeforeMatching() throws IOException {
        Path real = tempDir.toRealPath();
        Path site = Files.createDirectories(real.resolve("site"));
        Path installed = Files.createDirectories(site.resolve("R7.0.2-2.0/modules/motor/R6.9"));
        Path link = Files.createSymbolicLink(real.resolve("motor-current"), installed);

        PathConventionParser parser = new PathConventionParser(List.of(site.toString()));

        Optional<ModuleIdentity> identity = parser.parse(link.toString());

        assertThat(identity).isPresent();
        assertThat(identity.get().getName()).isEqualTo("motor");
        assertThat(identity.get().getTag()).isEqualTo("R6.9");
    }

    @Test
    void testResolveKeepsMissingRemainder() throws IOException {
        Path real = tempDir.toRealPath();

        Path resolved = PathConventionParser.resolve(real.resolve("missing/child"));

        assertThat(resolved).isEqualTo(real.resolve("missing/child"));
    }
}
