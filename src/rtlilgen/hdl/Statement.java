package rtlilgen.hdl;

/** A statement of a fragment body. Only assignments and switches exist; nesting happens through {@link Switch} cases. */
public sealed interface Statement permits Assign, Switch {}
