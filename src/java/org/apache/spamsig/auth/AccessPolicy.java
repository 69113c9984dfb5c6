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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The compiled form of an access file: for every user named by a rule, the set of
 * commands that user may run. A user who is not in the mapping may run nothing,
 * which is the effect of the implicit final rule {@code all : all : deny}.
 *
 * Instances are immutable. A changed access file produces a new instance rather
 * than modifying the one in use.
 */
public final class AccessPolicy
{
    private static final Logger logger = LoggerFactory.getLogger(AccessPolicy.class);

    private static final AccessPolicy EMPTY = new AccessPolicy(ImmutableMap.of());

    private static final AccessPolicy DEFAULT =
        new AccessPolicy(ImmutableMap.of(Account.ANONYMOUS_USER, ImmutableSortedSet.copyOf(Commands.ANONYMOUS_DEFAULT)));

    private final ImmutableMap<String, ImmutableSortedSet<String>> permissions;

    private AccessPolicy(ImmutableMap<String, ImmutableSortedSet<String>> permissions)
    {
        this.permissions = permissions;
    }

    /**
     * A policy which denies everything to everyone.
     */
    public static AccessPolicy empty()
    {
        return EMPTY;
    }

    /**
     * The policy in force when there is no access file: the anonymous user may use
     * the check, report, ping, pong and info commands and nobody else may do anything.
     */
    public static AccessPolicy defaultPolicy()
    {
        return DEFAULT;
    }

    /**
     * Apply the rules from top to bottom. For every user a rule names, an allow rule
     * adds its operations to the user's permitted set and a deny rule removes them,
     * so for any (user, command) pair the last rule mentioning it decides.
     *
     * @param rules the rules, in file order
     * @param knownUsers the users a rule for {@code all} users applies to
     */
    public static AccessPolicy compile(List<AccessRule> rules, Set<String> knownUsers)
    {
        Map<String, SortedSet<String>> working = new TreeMap<>();
        for (AccessRule rule : rules)
        {
            String operations = Joiner.on(',').join(rule.operations());
            for (String user : rule.users(knownUsers))
            {
                SortedSet<String> allowed = working.computeIfAbsent(user, u -> new TreeSet<>());
                if (rule.isAllow())
                {
                    logger.debug("Granting {} to {}", operations, user);
                    allowed.addAll(rule.operations());
                }
                else
                {
                    logger.debug("Revoking {} from {}", operations, user);
                    allowed.removeAll(rule.operations());
                }
            }
        }

        ImmutableMap.Builder<String, ImmutableSortedSet<String>> builder = ImmutableMap.builder();
        working.forEach((user, allowed) -> builder.put(user, ImmutableSortedSet.copyOf(allowed)));
        return new AccessPolicy(builder.build());
    }

    public boolean isAllowed(String username, String command)
    {
        ImmutableSortedSet<String> allowed = permissions.get(username);
        return allowed != null && allowed.contains(command);
    }

    /**
     * @return the commands the user may run, empty for a user no rule mentions
     */
    public ImmutableSortedSet<String> permissionsOf(String username)
    {
        return permissions.getOrDefault(username, ImmutableSortedSet.of());
    }

    public ImmutableMap<String, ImmutableSortedSet<String>> asMap()
    {
        return permissions;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof AccessPolicy))
            return false;

        return permissions.equals(((AccessPolicy) o).permissions);
    }

    public int hashCode()
    {
        return permissions.hashCode();
    }

    public String toString()
    {
        return "AccessPolicy " + permissions;
    }
}
