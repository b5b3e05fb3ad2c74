package rtlcore.hdl;

/** Visitor over the value variants. */
public interface ValueVisitor<R> {
  R visitConst(Const value);
  R visitSignal(Signal value);
  R visitOperator(Operator value);
  R visitSlice(Slice value);
  R visitPart(Part value);
  R visitCat(Cat value);
  R visitReplicate(Replicate value);
  R visitSelect(Select value);
  R visitSample(Sample value);
  R visitClockSignal(ClockSignal value);
  R visitResetSignal(ResetSignal value);
}
