package rtlilgen.backend;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import rtlilgen.hdl.Assign;
import rtlilgen.hdl.ClockDomain;
import rtlilgen.hdl.Const;
import rtlilgen.hdl.Fragment;
import rtlilgen.hdl.PortDirection;
import rtlilgen.hdl.Shape;
import rtlilgen.hdl.Signal;
import rtlilgen.hdl.SrcLoc;
import rtlilgen.hdl.Switch;
import rtlilgen.rtlil.RTLILBuilder;
import rtlilgen.ui.RTLILGenConfig;

class FragmentConverterTest {

  private static String counter() {
    Signal v = new Signal("v", Shape.unsigned(16), 65535);
    Signal o = new Signal("o");
    Fragment frag = new Fragment();
    frag.add("sync", new Assign(v, v.add(Const.of(1))));
    frag.add(Fragment.COMB, new Assign(o, v.bit(15)));
    return RTLIL.convert(frag, List.of(o));
  }

  @Test
  void testCounter() {
    String expected = "attribute \\generator \"rtlilgen\"\n"
                      + "attribute \\top 1\n"
                      + "module \\top\n"
                      + "  wire width 1 output 0 \\o\n"
                      + "  wire width 1 \\o$next\n"
                      + "  wire width 1 input 1 \\clk\n"
                      + "  wire width 1 input 2 \\rst\n"
                      + "  wire width 16 \\v\n"
                      + "  wire width 16 \\v$next\n"
                      + "  wire width 17 $2\n"
                      + "  cell $add $3\n"
                      + "    parameter \\A_SIGNED 0\n"
                      + "    parameter \\A_WIDTH 16\n"
                      + "    parameter \\B_SIGNED 0\n"
                      + "    parameter \\B_WIDTH 1\n"
                      + "    parameter \\Y_WIDTH 17\n"
                      + "    connect \\A \\v\n"
                      + "    connect \\B 1'1\n"
                      + "    connect \\Y $2\n"
                      + "  end\n"
                      + "  process $1\n"
                      + "    assign \\v$next \\v\n"
                      + "    assign \\o$next 1'0\n"
                      + "    assign \\v$next $2 [15:0]\n"
                      + "    assign \\o$next \\v [15]\n"
                      + "    sync init\n"
                      + "      update \\v 16'1111111111111111\n"
                      + "    sync posedge \\clk\n"
                      + "      update \\v \\v$next\n"
                      + "    sync always\n"
                      + "      update \\o \\o$next\n"
                      + "  end\n"
                      + "end\n";
    Assertions.assertEquals(expected, counter());
  }

  @Test
  void testOutputIsDeterministic() {
    Assertions.assertEquals(counter(), counter());
  }

  @Test
  void testSubmoduleBeforeParent() {
    Signal x = new Signal("x", 4);
    Signal y = new Signal("y", 4);
    Fragment inner = new Fragment();
    inner.add(Fragment.COMB, new Assign(y, x.not()));
    Fragment top = new Fragment();
    top.addSubfragment(inner, "inner");

    String expected = "attribute \\generator \"rtlilgen\"\n"
                      + "module \\inner\n"
                      + "  wire width 4 input 0 \\x\n"
                      + "  wire width 4 output 1 \\y\n"
                      + "  wire width 4 \\y$next\n"
                      + "  wire width 4 $2\n"
                      + "  cell $not $3\n"
                      + "    parameter \\A_SIGNED 0\n"
                      + "    parameter \\A_WIDTH 4\n"
                      + "    parameter \\Y_WIDTH 4\n"
                      + "    connect \\A \\x\n"
                      + "    connect \\Y $2\n"
                      + "  end\n"
                      + "  process $1\n"
                      + "    assign \\y$next 4'0000\n"
                      + "    assign \\y$next $2\n"
                      + "    sync init\n"
                      + "    sync always\n"
                      + "      update \\y \\y$next\n"
                      + "  end\n"
                      + "end\n"
                      + "attribute \\generator \"rtlilgen\"\n"
                      + "attribute \\top 1\n"
                      + "module \\top\n"
                      + "  wire width 4 input 0 \\x\n"
                      + "  wire width 4 output 1 \\y\n"
                      + "  cell \\inner \\inner\n"
                      + "    connect \\x \\x\n"
                      + "    connect \\y \\y\n"
                      + "  end\n"
                      + "  process $1\n"
                      + "    sync init\n"
                      + "  end\n"
                      + "end\n";
    Assertions.assertEquals(expected, RTLIL.convert(top, List.of(x, y)));
  }

  @Test
  void testSiblingSignalsGetInstancePrefix() {
    Signal x = new Signal("x", 4);
    Signal mid = new Signal("mid", 4);
    Signal y = new Signal("y", 4);
    Fragment first = new Fragment();
    first.add(Fragment.COMB, new Assign(mid, x.not()));
    Fragment second = new Fragment();
    second.add(Fragment.COMB, new Assign(y, mid.not()));
    Fragment top = new Fragment();
    top.addSubfragment(first, "first");
    top.addSubfragment(second, null);

    String text = RTLIL.convert(top, List.of(x, y));
    // mid only exists in the parent as the wire between the two instances
    Assertions.assertTrue(text.contains("  wire width 4 \\first_mid\n"), text);
    Assertions.assertTrue(text.contains("  cell \\first \\first\n    connect \\x \\x\n    connect \\mid \\first_mid\n  end\n"), text);
    Assertions.assertTrue(text.contains("module \\U$0\n"), text);
    Assertions.assertTrue(text.contains("  cell \\U$0 \\U$0\n    connect \\mid \\first_mid\n    connect \\y \\y\n  end\n"), text);
  }

  @Test
  void testSwitchLowering() {
    Signal sel = new Signal("sel", 2);
    Signal x = new Signal("x", 4);
    Signal out = new Signal("out", 4);
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Switch(sel, Switch.Case.defaultCase(new Assign(out, new Const(0, 4))),
                                       Switch.Case.of("01", new Assign(out, x))));
    String text = RTLIL.convert(frag, List.of(sel, x, out));
    Assertions.assertTrue(text.contains("    assign \\out$next 4'0000\n"
                                        + "    switch \\sel\n"
                                        + "      case 2'01\n"
                                        + "        assign \\out$next \\x\n"
                                        + "      case\n"
                                        + "        assign \\out$next 4'0000\n"
                                        + "    end\n"
                                        + "    sync init\n"
                                        + "    sync always\n"
                                        + "      update \\out \\out$next\n"),
                          text);
  }

  @Test
  void testResetValueAsCombDefault() {
    Signal s = new Signal("s", Shape.unsigned(8), 5);
    Signal en = new Signal("en");
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Switch(en, Switch.Case.of("1", new Assign(s, new Const(1, 8)))));
    String text = RTLIL.convert(frag, List.of(en, s));
    Assertions.assertTrue(text.contains("    assign \\s$next 8'00000101\n"), text);
    Assertions.assertFalse(text.contains("update \\s 8'"), text);
  }

  @Test
  void testResetValueHeldBySyncDefault() {
    Signal s = new Signal("s", Shape.unsigned(8), 5);
    Fragment frag = new Fragment();
    frag.addDriver(s, "sync");
    String text = RTLIL.convert(frag, List.of(s));
    Assertions.assertTrue(text.contains("  process $1\n"
                                        + "    assign \\s$next \\s\n"
                                        + "    sync init\n"
                                        + "      update \\s 8'00000101\n"
                                        + "    sync posedge \\clk\n"
                                        + "      update \\s \\s$next\n"
                                        + "  end\n"),
                          text);
  }

  @Test
  void testAsyncResetDomain() {
    Signal q = new Signal("q", Shape.unsigned(2), 2);
    Fragment frag = new Fragment();
    frag.addDomain(new ClockDomain("sync", true));
    frag.add("sync", new Assign(q, q.add(Const.of(1))));
    String text = RTLIL.convert(frag, List.of(q));
    Assertions.assertTrue(text.contains("    assign \\q$next \\q\n"), text);
    Assertions.assertTrue(text.contains("    sync init\n"
                                        + "      update \\q 2'10\n"
                                        + "    sync posedge \\clk\n"
                                        + "      update \\q \\q$next\n"
                                        + "    sync posedge \\rst\n"
                                        + "      update \\q \\q$next\n"),
                          text);
  }

  @Test
  void testNamedDomainSignals() {
    Signal q = new Signal("q");
    Fragment frag = new Fragment();
    frag.addDomain(new ClockDomain("pix"));
    frag.add("pix", new Assign(q, q.not()));
    String text = RTLIL.convert(frag, List.of(q));
    Assertions.assertTrue(text.contains("  wire width 1 input 1 \\pix_clk\n"), text);
    Assertions.assertTrue(text.contains("    sync posedge \\pix_clk\n"), text);
  }

  @Test
  void testWidthMismatchedAssignment() {
    Signal a = new Signal("a", 4);
    Signal wide = new Signal("wide", 8);
    Signal narrow = new Signal("narrow", 2);
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Assign(wide, a), new Assign(narrow, a));
    String text = RTLIL.convert(frag, List.of(a, wide, narrow));
    Assertions.assertTrue(text.contains("  cell $pos "), text);
    Assertions.assertTrue(text.contains("    assign \\narrow$next \\a [1:0]\n"), text);
  }

  @Test
  void testConfigAndSourceLocations() {
    Signal a = new Signal("a", Shape.unsigned(4), BigInteger.ZERO, new SrcLoc("top.py", 7));
    Signal y = new Signal("y", 4);
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Assign(y, a.not().withSrcLoc(new SrcLoc("top.py", 9))));

    RTLILGenConfig cfg = new RTLILGenConfig();
    cfg.generator = "mygen";
    cfg.emit_src = false;
    String text = RTLIL.convert(frag, "alu", List.of(a, y), cfg);
    Assertions.assertTrue(text.startsWith("attribute \\generator \"mygen\"\nattribute \\top 1\nmodule \\alu\n"), text);
    Assertions.assertFalse(text.contains("\\src"), text);

    Fragment again = new Fragment();
    again.add(Fragment.COMB, new Assign(y, a.not().withSrcLoc(new SrcLoc("top.py", 9))));
    String withSrc = RTLIL.convert(again, List.of(a, y));
    Assertions.assertTrue(withSrc.contains("  attribute \\src \"top.py:7\"\n  wire width 4 input 0 \\a\n"), withSrc);
    Assertions.assertTrue(withSrc.contains("  attribute \\src \"top.py:9\"\n  cell $not "), withSrc);
  }

  @Test
  void testPortMapCorrelatesWiresWithSignals() {
    Signal p = new Signal("p", 3);
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Assign(p, new Const(2, 3)));
    frag.addPort(p, PortDirection.OUTPUT);
    RTLILBuilder builder = new RTLILBuilder("rtlilgen");
    ConvertedModule converted = new FragmentConverter(new RTLILGenConfig()).convertFragment(builder, frag, null, false);
    Assertions.assertEquals("\\anonymous", converted.name());
    Assertions.assertEquals(Map.of("\\p", p), converted.portMap());
    Assertions.assertTrue(builder.toString().contains("  wire width 3 output 0 \\p\n"));
  }

  @Test
  void testUnsupportedTarget() {
    Signal a = new Signal("a", 4);
    Fragment frag = new Fragment();
    frag.addStatements(new Assign(a.slice(0, 2), new Const(0, 2)));
    frag.addDriver(a, Fragment.COMB);
    Assertions.assertThrows(UnsupportedOperationException.class, () -> RTLIL.convert(frag, List.of(a)));
  }
}
