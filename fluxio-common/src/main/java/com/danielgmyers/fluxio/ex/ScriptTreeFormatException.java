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

/**
 * Indicates that a serialized script tree could not be read, e.g. it was not valid json
 * or it contained a node type the reader does not know.
 */
public class ScriptTreeFormatException extends RuntimeException {

    public ScriptTreeFormatException(String message) {
        super(message);
    }

    public ScriptTreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
