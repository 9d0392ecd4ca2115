package io.intellixity.matviews.spi.exec;

import io.intellixity.matviews.response.ServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Drives a {@link MatViewService} through {@code assignRequest -> prepare -> execute}.
 * <p>
 * Never lets an operation failure escape: exceptions (and non-fatal errors) become
 * {@code ServiceResponse{status=error}}. Only {@link VirtualMachineError}s are rethrown.
 */
public final class ServiceRunner {
  private static final Logger log = LoggerFactory.getLogger(ServiceRunner.class);

  private ServiceRunner() {}

  public static ServiceResponse run(MatViewService service) {
    Objects.requireNonNull(service, "service");
    long start = System.nanoTime();
    try {
      service.assignRequest();
      service.prepare();
      ServiceResponse out = service.execute();
      if (out == null) throw new IllegalStateException(service.operation() + " returned no response");
      log.info("matviews op={} status={} durationMs={}", service.operation(), out.status().id(), millisSince(start));
      return out;
    } catch (VirtualMachineError fatal) {
      throw fatal;
    } catch (RuntimeException | Error e) {
      log.warn("matviews op={} failed durationMs={} error={}: {}",
          service.operation(), millisSince(start), e.getClass().getName(), e.getMessage());
      log.debug("matviews op={} failure", service.operation(), e);
      return ServiceResponse.error(e, service.request(), service.response());
    }
  }

  private static double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
