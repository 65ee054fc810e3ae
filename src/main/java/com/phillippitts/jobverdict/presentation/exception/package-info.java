/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>Bean validation failures and {@link com.phillippitts.jobverdict.exception.InvalidJobInputException}
 *       → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.GazetteerLoadException} and
 *       {@link com.phillippitts.jobverdict.exception.PromptTemplateException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.jobverdict.exception.EvaluationCancelledException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidJobInputException",
 *   "message": "Invalid job input",
 *   "details": "Invalid job input (jobDescription): must not be blank",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>LLM transport failures never reach this layer: the orchestrators turn them into degraded results.
 */
package com.phillippitts.jobverdict.presentation.exception;
