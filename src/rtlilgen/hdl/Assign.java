package rtlilgen.hdl;

/** Drives {@code target} with {@code value}. */
public record Assign(Value target, Value value) implements Statement {}
