package com.partsbin.core.match;

import com.partsbin.core.model.ComponentIdentity;

record ScoredCandidate(ComponentIdentity identity, int usageCount, double score, double lexicalCloseness) {
}
