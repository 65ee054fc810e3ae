/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.jobverdict.exception.JobVerdictException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.TransportException} - LLM endpoint unreachable,
 *       timed out, or returned a malformed response</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.PromptTemplateException} - Prompt template missing
 *       or rendered without a required slot</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.GazetteerLoadException} - Gazetteer tables missing
 *       or unreadable at startup</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.InvalidJobInputException} - Caller supplied blank
 *       or oversized input</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.EvaluationCancelledException} - Caller cancelled an
 *       evaluation while runs were in flight</li>
 * </ul>
 *
 * <p>Transport failures never escape the orchestrators; they are converted to degraded results.
 * The remaining exceptions map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.jobverdict.exception.JobVerdictException
 * @since 1.0
 */
package com.phillippitts.jobverdict.exception;
