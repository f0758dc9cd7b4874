package com.flamingo.ai.knowledge.service.worker;

import java.util.UUID;

/** A processing job delivered by the external job queue. */
public record DocumentJob(UUID documentId) {}
