/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.railway.core.observability;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observer that writes one audit record per step, tagged with a workflow id.
 */
public class AuditLogger implements StepObserver {

    private static final Logger logger = Logger.getLogger(AuditLogger.class.getName());

    public static final String UNKNOWN_WORKFLOW_ID = "unknown";

    private final String workflowId;

    public AuditLogger() {
        this(UNKNOWN_WORKFLOW_ID);
    }

    public AuditLogger(String workflowId) {
        this.workflowId = workflowId != null && !workflowId.isBlank() ? workflowId : UNKNOWN_WORKFLOW_ID;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    @Override
    public void onStep(String nodeName, String state, Object context) {
        logger.log(Level.INFO, "[{0}] {1} -> {2}", new Object[]{workflowId, nodeName, state});
    }
}
