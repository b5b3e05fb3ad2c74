package rtlcore.sim;

/** Body of a simulation process. Runs as a coroutine: it suspends whenever it waits on its context. */
@FunctionalInterface
public interface SimProcess {
  void run(SimContext ctx) throws Exception;
}
