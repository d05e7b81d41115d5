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

package com.danielgmyers.fluxio.sfn.util;

/**
 * Naming conventions for the deployment-time identifiers referenced by compiled state machines.
 * The compiler never resolves these; it emits {@code ${Name}} placeholders that the deployment tooling substitutes.
 */
public final class ResourceNaming {

    public static final String ECS_CLUSTER_ARN = "ECSClusterArn";
    public static final String DATABASE_SECURITY_GROUP = "DatabaseSecurityGroup";
    public static final String PRIVATE_LOAD_BALANCER_SECURITY_GROUP = "PrivateLoadBalancerSecurityGroup";
    public static final int SUBNET_COUNT = 4;

    private ResourceNaming() {}

    public static String placeholder(String variableName) {
        return "${" + variableName + "}";
    }

    /**
     * Title-cases a declared name the way the deployment tooling does: every letter that follows a
     * non-letter is upper-cased, every other letter is lower-cased, and spaces are dropped.
     * For example {@code main} becomes {@code Main} and {@code my_flow} becomes {@code My_Flow}.
     */
    public static String normalizedName(String name) {
        StringBuilder sb = new StringBuilder();
        boolean previousWasLetter = false;
        for (char c : name.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousWasLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousWasLetter = true;
            } else {
                if (c != ' ') {
                    sb.append(c);
                }
                previousWasLetter = false;
            }
        }
        return sb.toString();
    }

    public static String stateMachineLogicalId(String functionName) {
        return normalizedName(functionName) + "StateMachineStack";
    }

    /**
     * The variable holding a nested state machine's ARN. Unlike the logical id, this uses the function name as declared.
     */
    public static String stateMachine(String functionName) {
        return "StateMachine" + functionName;
    }

    public static String lambdaFunction(String taskName) {
        return "LambdaFunction" + taskName;
    }

    public static String packageName(String taskName) {
        return "PackageName" + taskName;
    }

    public static String packageVersion(String taskName) {
        return "PackageVersion" + taskName;
    }

    public static String ecsTaskDefinition(String taskName) {
        return "ECSTaskDefinition" + taskName;
    }

    public static String queueUrl(String taskName) {
        return "QueueUrl" + taskName;
    }

    public static String codeBuildProjectName(String taskName) {
        return "CodeBuildProjectName" + taskName;
    }

    public static String subnet(int index) {
        return "Subnet" + index;
    }
}
