/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.fluxio.ex;

import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.ast.SourceRenderer;

/**
 * Indicates that a workflow script uses a construct the compiler does not support,
 * or uses a supported construct in an illegal way.
 *
 * When the offending script node is known, the message ends with its position and rendered source.
 */
public class WorkflowGraphBuildException extends RuntimeException {

    private static final int UNKNOWN_POSITION = -1;

    private final String reason;
    private final int line;
    private final int column;
    private final String source;

    /**
     * Creates a WorkflowGraphBuildException that is not tied to a specific script node.
     * @param message The message to include in the exception.
     */
    public WorkflowGraphBuildException(String message) {
        super(message);
        this.reason = message;
        this.line = UNKNOWN_POSITION;
        this.column = UNKNOWN_POSITION;
        this.source = null;
    }

    /**
     * Creates a WorkflowGraphBuildException.
     * @param message The message to include in the exception.
     * @param node    The script node that caused the problem.
     */
    public WorkflowGraphBuildException(String message, Node node) {
        this(message, node, null);
    }

    /**
     * Creates a WorkflowGraphBuildException.
     * @param message The message to include in the exception.
     * @param node    The script node that caused the problem.
     * @param cause   The cause of the exception.
     */
    public WorkflowGraphBuildException(String message, Node node, Throwable cause) {
        super(format(message, node), cause);
        this.reason = message;
        this.line = node.getLine();
        this.column = node.getColumn();
        this.source = SourceRenderer.render(node);
    }

    /**
     * Throws a WorkflowGraphBuildException for the given node unless the condition holds.
     */
    public static void check(boolean condition, String message, Node node) {
        if (!condition) {
            throw new WorkflowGraphBuildException(message, node);
        }
    }

    private static String format(String message, Node node) {
        String trimmed = message;
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return String.format("%s.\n\nProvided (Line %d, Column %d):\n\n%s", trimmed, node.getLine(), node.getColumn(),
                             SourceRenderer.render(node));
    }

    /**
     * The message without the position and source rendering.
     */
    public String getReason() {
        return reason;
    }

    /**
     * The line of the offending node, or -1 if unknown.
     */
    public int getLine() {
        return line;
    }

    /**
     * The column of the offending node, or -1 if unknown.
     */
    public int getColumn() {
        return column;
    }

    /**
     * The rendered source of the offending node, or null if unknown.
     */
    public String getSource() {
        return source;
    }
}
