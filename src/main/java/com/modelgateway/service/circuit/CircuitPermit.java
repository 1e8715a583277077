package com.modelgateway.service.circuit;

/**
 * Permission to make one call to a provider. Outcomes are reported against the
 * permit, so a call that started before the circuit last opened cannot decide
 * a later probe.
 *
 * @param provider   provider the call goes to
 * @param generation circuit generation the permit was issued under
 * @param probe      whether this is the single half-open probe
 */
public record CircuitPermit(String provider, long generation, boolean probe) {
}
