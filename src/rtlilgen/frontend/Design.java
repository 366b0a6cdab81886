package rtlilgen.frontend;

import java.util.List;
import rtlilgen.hdl.Fragment;
import rtlilgen.hdl.Signal;

/**
 * A design read from a description file.
 * @param name the top module name, null if the file does not name it
 * @param top the top fragment
 * @param ports signals requested as ports of the top module
 */
public record Design(String name, Fragment top, List<Signal> ports) {}
