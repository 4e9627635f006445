package io.liveprobe.core.workload;

import io.liveprobe.core.routing.DocumentKey;

import java.util.Map;
import java.util.Random;

/**
 * Produces the payload fields of an inserted document.
 */
@FunctionalInterface
public interface PayloadGenerator {

    Map<String, Object> generate(DocumentKey key, Random rnd);
}
