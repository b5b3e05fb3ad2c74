package rtlcore.ir;

import java.util.ArrayList;
import java.util.List;
import rtlcore.hdl.Assign;
import rtlcore.hdl.Cat;
import rtlcore.hdl.ClockSignal;
import rtlcore.hdl.Const;
import rtlcore.hdl.Operator;
import rtlcore.hdl.Part;
import rtlcore.hdl.Property;
import rtlcore.hdl.Replicate;
import rtlcore.hdl.ResetSignal;
import rtlcore.hdl.Sample;
import rtlcore.hdl.Select;
import rtlcore.hdl.Signal;
import rtlcore.hdl.Slice;
import rtlcore.hdl.Statement;
import rtlcore.hdl.StatementVisitor;
import rtlcore.hdl.Switch;
import rtlcore.hdl.Value;
import rtlcore.hdl.ValueVisitor;

/**
 * Rebuilds value and statement trees bottom-up. Subclasses override the visit methods of the nodes they
 * replace; all other nodes are copied with transformed children. Nodes whose children are unchanged are
 * returned as they are, so statements keep their identity when nothing in them was replaced.
 */
public class ValueTransformer implements ValueVisitor<Value>, StatementVisitor<Statement> {

  public Value transform(Value value) { return value.accept(this); }
  public Statement transform(Statement statement) { return statement.accept(this); }
  public List<Statement> transform(List<? extends Statement> statements) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements)
      result.add(transform(statement));
    return result;
  }

  protected List<Value> transformAll(List<Value> values) {
    List<Value> result = new ArrayList<>(values.size());
    for (Value value : values)
      result.add(transform(value));
    return result;
  }

  private static boolean same(List<?> a, List<?> b) {
    for (int i = 0; i < a.size(); ++i) {
      if (a.get(i) != b.get(i))
        return false;
    }
    return true;
  }

  @Override
  public Value visitConst(Const value) {
    return value;
  }
  @Override
  public Value visitSignal(Signal value) {
    return value;
  }
  @Override
  public Value visitOperator(Operator value) {
    List<Value> operands = transformAll(value.getOperands());
    return same(operands, value.getOperands()) ? value : new Operator(value.getKind(), operands);
  }
  @Override
  public Value visitSlice(Slice value) {
    Value inner = transform(value.getValue());
    return inner == value.getValue() ? value : new Slice(inner, value.getStart(), value.getStop());
  }
  @Override
  public Value visitPart(Part value) {
    Value inner = transform(value.getValue());
    Value offset = transform(value.getOffset());
    if (inner == value.getValue() && offset == value.getOffset())
      return value;
    return new Part(inner, offset, value.getPartWidth(), value.getStride());
  }
  @Override
  public Value visitCat(Cat value) {
    List<Value> parts = transformAll(value.getParts());
    return same(parts, value.getParts()) ? value : new Cat(parts);
  }
  @Override
  public Value visitReplicate(Replicate value) {
    Value inner = transform(value.getValue());
    return inner == value.getValue() ? value : new Replicate(inner, value.getCount());
  }
  @Override
  public Value visitSelect(Select value) {
    Value index = transform(value.getIndex());
    List<Value> choices = transformAll(value.getChoices());
    if (index == value.getIndex() && same(choices, value.getChoices()))
      return value;
    return new Select(index, choices);
  }
  @Override
  public Value visitSample(Sample value) {
    Value inner = transform(value.getValue());
    return inner == value.getValue() ? value : new Sample(inner, value.getDomain(), value.getClocks());
  }
  @Override
  public Value visitClockSignal(ClockSignal value) {
    return value;
  }
  @Override
  public Value visitResetSignal(ResetSignal value) {
    return value;
  }

  @Override
  public Statement visitAssign(Assign statement) {
    Value target = transform(statement.getTarget());
    Value source = transform(statement.getSource());
    if (target == statement.getTarget() && source == statement.getSource())
      return statement;
    return new Assign(target, source);
  }
  @Override
  public Statement visitSwitch(Switch statement) {
    Value test = transform(statement.getTest());
    boolean changed = test != statement.getTest();
    List<Switch.Case> cases = new ArrayList<>(statement.getCases().size());
    for (Switch.Case c : statement.getCases()) {
      List<Statement> body = transform(c.getBody());
      if (same(body, c.getBody()))
        cases.add(c);
      else {
        cases.add(c.withBody(body));
        changed = true;
      }
    }
    return changed ? Switch.fromCases(test, cases) : statement;
  }
  @Override
  public Statement visitProperty(Property statement) {
    Value condition = transform(statement.getCondition());
    return condition == statement.getCondition() ? statement : new Property(statement.getKind(), condition, statement.getName());
  }
}
