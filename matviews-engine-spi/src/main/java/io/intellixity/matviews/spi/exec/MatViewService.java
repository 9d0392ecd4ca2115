package io.intellixity.matviews.spi.exec;

import io.intellixity.matviews.response.ServiceResponse;

import java.util.Map;

/**
 * One lifecycle operation, split into the three phases {@link ServiceRunner} drives in order.\n
 *
 * - {@link #assignRequest()}: normalize and record input options\n
 * - {@link #prepare()}: throw on any precondition violation\n
 * - {@link #execute()}: run the SQL and build the response\n
 *
 * Phases may throw freely; the runner turns any exception into an error response built from
 * {@link #request()} and {@link #response()} as recorded so far.
 */
public interface MatViewService {
  /** Short operation name used in logs. */
  String operation();

  void assignRequest();

  void prepare();

  ServiceResponse execute();

  Map<String, Object> request();

  Map<String, Object> response();
}
