package com.modelrouter.router.policy;

import com.modelrouter.common.model.PolicyMatch;

import java.time.Instant;

record CachedPolicy(PolicyMatch match, Instant fetchedAt) {}
