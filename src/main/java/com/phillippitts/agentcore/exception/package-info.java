/**
 * Application exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.agentcore.exception.AgentCoreException}
 * (unchecked) so the REST boundary can translate them in one place. Groups:
 * <ul>
 *   <li>Reasoning: {@code DelegateNotFoundException}, {@code DelegateFailureException},
 *       {@code MalformedTurnException}, {@code ReasoningBackendException}</li>
 *   <li>Backends: {@code UnknownBackendException}, {@code BackendNotReadyException},
 *       {@code DuplicateBackendException}, {@code BackendOperationException},
 *       {@code ModelNotFoundException}, {@code AssetAcquisitionException}</li>
 *   <li>Queue: {@code QueueFullException}, {@code RequestNotFoundException}</li>
 *   <li>Pipeline: {@code PipelineStageException}, {@code InvalidAudioException}</li>
 * </ul>
 *
 * @see com.phillippitts.agentcore.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.agentcore.exception;
