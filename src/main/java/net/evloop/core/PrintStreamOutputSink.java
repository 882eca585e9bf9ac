package net.evloop.core;

import java.io.PrintStream;
import net.evloop.core.data.EventResult;
import net.evloop.core.exceptions.OutputSinkException;

/**
 * Writes each result to a {@link PrintStream}, one blank-line separated block per result.
 */
public class PrintStreamOutputSink implements OutputSink {
  private final PrintStream out;

  public PrintStreamOutputSink(PrintStream out) {
    this.out = out;
  }

  @Override
  public void emit(EventResult result) {
    synchronized (out) {
      out.println();
      out.println(OutputSink.format(result));
      out.println();
      out.flush();

      // PrintStream swallows IOExceptions and only records them.
      if (out.checkError()) {
        throw new OutputSinkException("failed to write output for event " + result.key());
      }
    }
  }
}
