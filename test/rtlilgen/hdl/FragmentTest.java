package rtlilgen.hdl;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FragmentTest {

  @Test
  void testDriversGroupedByDomain() {
    Signal a = new Signal("a");
    Signal b = new Signal("b");
    Signal c = new Signal("c");
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Assign(a, b));
    frag.add("sync", new Assign(c, a));
    frag.add(Fragment.COMB,
             new Switch(c, Switch.Case.of("1", new Assign(b, new Const(1, 1))), Switch.Case.defaultCase(new Assign(a, c))));

    Assertions.assertEquals(List.of(Fragment.COMB, "sync"), List.copyOf(frag.getDrivers().keySet()));
    Assertions.assertEquals(List.of(a, b), List.copyOf(frag.getDrivers().get(Fragment.COMB)));
    Assertions.assertEquals(List.of(Map.entry("sync", c)), frag.iterSync());
    Assertions.assertEquals(List.of("sync"), frag.getSyncDomainNames());
    Assertions.assertEquals("sync", frag.getDriverDomain(c).orElseThrow());
    Assertions.assertEquals(3, frag.getStatements().size());
  }

  @Test
  void testSignalDrivenFromTwoDomains() {
    Signal a = new Signal("a");
    Fragment frag = new Fragment();
    frag.add(Fragment.COMB, new Assign(a, new Const(0, 1)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> frag.add("sync", new Assign(a, new Const(1, 1))));
  }

  @Test
  void testPortDirectionConflict() {
    Signal a = new Signal("a");
    Fragment frag = new Fragment();
    frag.addPort(a, PortDirection.INPUT);
    frag.addPort(a, PortDirection.INPUT);
    Assertions.assertThrows(IllegalArgumentException.class, () -> frag.addPort(a, PortDirection.OUTPUT));
  }

  @Test
  void testDomains() {
    Fragment frag = new Fragment();
    frag.addDomain(new ClockDomain("sync"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> frag.addDomain(new ClockDomain("sync")));
    Assertions.assertThrows(IllegalStateException.class, () -> frag.getDomain("pix"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ClockDomain(Fragment.COMB));
    Assertions.assertEquals("clk", frag.getDomain("sync").getClk().getName());
    Assertions.assertEquals("pix_rst", new ClockDomain("pix").getRst().getName());
  }

  @Test
  void testUsedSignalsIncludeSwitchTest() {
    Signal sel = new Signal("sel");
    Signal a = new Signal("a");
    Signal b = new Signal("b");
    Switch sw = new Switch(sel, Switch.Case.of("1", new Assign(a, b)));
    Assertions.assertEquals(List.of(sel, b), List.copyOf(Fragment.usedSignals(sw)));
    Assertions.assertEquals(List.of(a), List.copyOf(Fragment.assignedSignals(sw)));
  }
}
