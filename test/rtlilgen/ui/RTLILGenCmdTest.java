package rtlilgen.ui;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RTLILGenCmdTest {
  private ByteArrayOutputStream outBytes;
  private PrintStream out;

  @TempDir
  Path tempDir;

  @BeforeEach
  void setUp() {
    outBytes = new ByteArrayOutputStream();
    out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
  }

  private String output() { return outBytes.toString(StandardCharsets.UTF_8); }

  private static String resource(String name) throws URISyntaxException {
    return new File(RTLILGenCmdTest.class.getResource("/" + name).toURI()).getPath();
  }

  @Test
  void testConvertToStdout() throws URISyntaxException {
    Assertions.assertEquals(0, RTLILGenCmd.run(new String[] {"-q", "-d", resource("counter.yaml")}, out));
    Assertions.assertTrue(output().startsWith("attribute \\generator \"rtlilgen\"\nattribute \\top 1\nmodule \\counter\n"), output());
  }

  @Test
  void testTopNameAndConfig() throws URISyntaxException {
    String[] args = {"-q", "-d", resource("counter.yaml"), "-t", "cnt", "-c", resource("config.yaml")};
    Assertions.assertEquals(0, RTLILGenCmd.run(args, out));
    Assertions.assertTrue(output().startsWith("attribute \\generator \"mygen\"\nattribute \\top 1\nmodule \\cnt\n"), output());
  }

  @Test
  void testOutputFile() throws URISyntaxException, IOException {
    Path target = tempDir.resolve("counter.il");
    String[] args = {"-q", "-d", resource("hierarchy.yaml"), "-o", target.toString()};
    Assertions.assertEquals(0, RTLILGenCmd.run(args, out));
    Assertions.assertEquals("", output());
    Assertions.assertTrue(Files.readString(target).contains("module \\chain\n"));
  }

  @Test
  void testUsageErrors() {
    Assertions.assertEquals(2, RTLILGenCmd.run(new String[] {}, out));
    Assertions.assertEquals(2, RTLILGenCmd.run(new String[] {"-d"}, out));
    Assertions.assertEquals(2, RTLILGenCmd.run(new String[] {"--frobnicate"}, out));
    Assertions.assertEquals(0, RTLILGenCmd.run(new String[] {"-h"}, out));
  }

  @Test
  void testInvalidInputs() throws URISyntaxException {
    Assertions.assertEquals(1, RTLILGenCmd.run(new String[] {"-q", "-d", resource("bad_signal.yaml")}, out));
    Assertions.assertEquals(1, RTLILGenCmd.run(new String[] {"-q", "-d", tempDir.resolve("absent.yaml").toString()}, out));
    String[] badConfig = {"-q", "-d", resource("counter.yaml"), "-c", tempDir.resolve("absent.yaml").toString()};
    Assertions.assertEquals(1, RTLILGenCmd.run(badConfig, out));
    Assertions.assertEquals("", output());
  }

  @Test
  void testConversionErrorIsReported() throws IOException {
    Path design = tempDir.resolve("slice_target.yaml");
    Files.writeString(design, "signals: [{name: a, width: 4}]\n"
                                  + "top: {statements: [{assign: {slice: a, start: 0, end: 2}, value: 0}]}\n");
    Assertions.assertEquals(1, RTLILGenCmd.run(new String[] {"-q", "-d", design.toString()}, out));
  }

  @Test
  void testParseConfig() throws URISyntaxException, IOException {
    RTLILGenConfig cfg = RTLILGenCmd.parseConfig(new File(resource("config.yaml")));
    Assertions.assertEquals("mygen", cfg.generator);
    Assertions.assertFalse(cfg.emit_src);
    Assertions.assertEquals("top", cfg.top_name);

    Path empty = tempDir.resolve("empty.yaml");
    Files.writeString(empty, "");
    Assertions.assertEquals("rtlilgen", RTLILGenCmd.parseConfig(empty.toFile()).generator);
  }
}
