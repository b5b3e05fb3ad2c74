package rtlcore.ir;

import java.util.List;
import rtlcore.hdl.ClockSignal;
import rtlcore.hdl.Const;
import rtlcore.hdl.ElaborationException;
import rtlcore.hdl.ResetDisciplineException;
import rtlcore.hdl.ResetSignal;
import rtlcore.hdl.Sample;
import rtlcore.hdl.Shape;
import rtlcore.hdl.Statement;
import rtlcore.hdl.Value;

/**
 * Replaces domain references of one module's statements: clock and reset references become the signals of
 * the resolved domain, samples become register chains.
 */
class DomainLowerer extends ValueTransformer {

  /** Carries a checked elaboration error out of the visitor. */
  private static final class Failure extends RuntimeException {
    private static final long serialVersionUID = 1L;
    final ElaborationException error;
    Failure(ElaborationException error) {
      super(error);
      this.error = error;
    }
  }

  private final DomainScope scope;
  private final SampleRegisters registers;

  DomainLowerer(DomainScope scope, SampleRegisters registers) {
    this.scope = scope;
    this.registers = registers;
  }

  List<Statement> lower(List<Statement> statements) throws ElaborationException {
    try {
      return transform(statements);
    } catch (Failure failure) {
      throw failure.error;
    }
  }

  private ResolvedDomain resolve(String name) {
    try {
      return scope.resolve(name);
    } catch (ElaborationException e) {
      throw new Failure(e);
    }
  }

  @Override
  public Value visitSample(Sample value) {
    Value inner = transform(value.getValue());
    if (value.getClocks() == 0)
      return inner;
    ResolvedDomain domain = resolve(value.getDomain());
    return registers.get(inner, domain.name(), value.getClocks());
  }
  @Override
  public Value visitClockSignal(ClockSignal value) {
    return resolve(value.getDomain()).domain().getClk();
  }
  @Override
  public Value visitResetSignal(ResetSignal value) {
    ResolvedDomain domain = resolve(value.getDomain());
    if (domain.domain().getRst().isPresent())
      return domain.domain().getRst().get();
    if (value.isAllowResetLess())
      return Const.of(0, Shape.unsigned(1));
    throw new Failure(new ResetDisciplineException("Signal " + value + " refers to reset of reset-less domain '" + domain.name() + "'",
                                                   domain.name()));
  }
}
