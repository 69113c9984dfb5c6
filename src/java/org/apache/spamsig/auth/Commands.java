/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.spamsig.auth;

import com.google.common.collect.ImmutableSet;

/**
 * Names of the commands access rules grant and revoke.
 */
public final class Commands
{
    public static final String CHECK = "check";
    public static final String REPORT = "report";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String INFO = "info";
    public static final String WHITELIST = "whitelist";

    /** What the keyword {@code all} means in the operations column of an access rule. */
    public static final ImmutableSet<String> ALL = ImmutableSet.of(CHECK, REPORT, PING, PONG, INFO, WHITELIST);

    /** Granted to the anonymous user when no access file exists. */
    public static final ImmutableSet<String> ANONYMOUS_DEFAULT = ImmutableSet.of(CHECK, REPORT, PING, PONG, INFO);

    private Commands()
    {
    }
}
