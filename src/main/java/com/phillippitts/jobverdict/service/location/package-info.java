/**
 * Hybrid location validation: a deterministic gazetteer pass, LLM adjudication for low-confidence
 * cases, and safety overrides that clear conflicts the evidence does not support.
 *
 * @see com.phillippitts.jobverdict.service.location.HybridLocationValidator
 */
package com.phillippitts.jobverdict.service.location;
