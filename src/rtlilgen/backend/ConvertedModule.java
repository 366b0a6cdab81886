package rtlilgen.backend;

import java.util.Map;
import rtlilgen.hdl.Signal;

/**
 * Result of converting one fragment.
 * @param name the RTLIL module name assigned to the fragment
 * @param portMap the module's port wire names, in port order, mapped to the signals they carry
 */
public record ConvertedModule(String name, Map<String, Signal> portMap) {}
