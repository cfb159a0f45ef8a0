package com.scholary.songgen.service;

import com.scholary.songgen.job.JobRecord;

/** Outcome of rebuilding one job's artifact manifest. */
public record RepairResult(boolean repaired, String message, JobRecord job) {}
