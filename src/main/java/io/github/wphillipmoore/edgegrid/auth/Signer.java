package io.github.wphillipmoore.edgegrid.auth;

import io.github.wphillipmoore.edgegrid.TransportRequest;

/**
 * Attaches authentication headers to an outgoing request.
 *
 * <p>Called once per wire request: every retry attempt and every redirect hop is signed again on a
 * fresh copy, so implementations may depend on the current time and must not cache signatures.
 */
@FunctionalInterface
public interface Signer {

  /**
   * Signs {@code request} in place.
   *
   * @param request the request about to be sent
   */
  void sign(TransportRequest request);
}
