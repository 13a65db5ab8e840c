package com.spinemlgen.core.handler;

/**
 * The four handler roles one model kind plugs into the shared regime traversal.
 */
public record RegimeHandlers(
    ObjectHandler condition,
    ObjectHandler event,
    ObjectHandler impulse,
    ObjectHandler timeDerivative
) {}
