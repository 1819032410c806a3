package com.platform.podset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PodSet Operator
 *
 * Keeps the number of live busybox pods labelled for each PodSet equal to its
 * {@code spec.replicas}, and reports their names in {@code status.podNames}.
 *
 * - Watches PodSets and their pods through informers
 * - Reconciles one PodSet per worker, requeueing with per-key backoff
 * - Optional sweep of pods whose PodSet is gone
 */
@SpringBootApplication
@EnableScheduling
public class PodSetOperatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodSetOperatorApplication.class, args);
    }
}
