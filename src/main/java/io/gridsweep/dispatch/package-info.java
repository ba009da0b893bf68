/**
 * Bounded, retrying submission of combinations to a remote job service.
 * Workers never share combination state; results are handed to a
 * {@link io.gridsweep.dispatch.ResultHandler} on the worker that produced them.
 */
package io.gridsweep.dispatch;
