package com.scholary.songgen.service;

import com.scholary.songgen.job.JobRecord;

/**
 * A job snapshot plus values derived from the live queue. {@code queuePosition} and {@code
 * estimatedWaitSeconds} are null once the job has left the queue.
 */
public record JobView(JobRecord job, Integer queuePosition, Long estimatedWaitSeconds) {}
