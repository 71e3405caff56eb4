/**
 * Copyright Pravega Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.prioq.common;

import org.slf4j.Logger;

/**
 * Extension methods for Logger class, used to trace entry into (and exit from) the more expensive queue operations.
 */
public final class LoggerHelpers {
    private LoggerHelpers() {
    }

    /**
     * Traces the fact that a method entry has occurred.
     *
     * @param log     The Logger to log to.
     * @param context Identifying context for the operation. For example, this can be used to differentiate between
     *                different queue instances.
     * @param method  The name of the method.
     * @param args    The arguments to the method.
     * @return A generated identifier that can be used to correlate this traceEnter with its corresponding traceLeave.
     * This is the current System.nanoTime(), so traceLeave can log the elapsed time. Returns 0 if trace is disabled.
     */
    public static long traceEnterWithContext(Logger log, String context, String method, Object... args) {
        if (!log.isTraceEnabled()) {
            return 0;
        }

        long time = System.nanoTime();
        log.trace("ENTER {}::{}@{} {}.", context, method, time, args);
        return time;
    }

    /**
     * Traces the fact that a method has exited normally.
     *
     * @param log          The Logger to log to.
     * @param context      Identifying context for the operation.
     * @param method       The name of the method.
     * @param traceEnterId The correlation Id obtained from a traceEnterWithContext call.
     * @param args         Additional arguments to log.
     */
    public static void traceLeave(Logger log, String context, String method, long traceEnterId, Object... args) {
        if (!log.isTraceEnabled()) {
            return;
        }

        long elapsedMicros = (System.nanoTime() - traceEnterId) / 1000;
        if (args.length == 0) {
            log.trace("LEAVE {}::{}@{} (elapsed={}us).", context, method, traceEnterId, elapsedMicros);
        } else {
            log.trace("LEAVE {}::{}@{} {} (elapsed={}us).", context, method, traceEnterId, args, elapsedMicros);
        }
    }
}
