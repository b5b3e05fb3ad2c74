package rtlcore.hdl;

/** Visitor over the statement variants. */
public interface StatementVisitor<R> {
  R visitAssign(Assign statement);
  R visitSwitch(Switch statement);
  R visitProperty(Property statement);
}
