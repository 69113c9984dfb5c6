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
import java.util.Locale;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

import org.apache.spamsig.exceptions.InvalidLineException;

/**
 * One line of the access file:
 * <pre>
 *     operations : users : allow|deny
 * </pre>
 * where operations is a whitespace separated list of command names or the keyword
 * {@code all} (every command in {@link Commands#ALL}), and users is a whitespace
 * separated list of usernames or the keyword {@code all}. The users {@code all}
 * refers to is only known when the rule is applied, see {@link #users(Set)}.
 */
public final class AccessRule
{
    public static final String ALL = "all";

    private static final Splitter FIELDS = Splitter.on(':').trimResults();
    private static final Splitter TOKENS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final ImmutableSet<String> operations;
    // null means every known user
    private final ImmutableSet<String> users;
    private final boolean allow;

    private AccessRule(ImmutableSet<String> operations, ImmutableSet<String> users, boolean allow)
    {
        this.operations = operations;
        this.users = users;
        this.allow = allow;
    }

    public static AccessRule allow(Set<String> operations, Set<String> users)
    {
        return new AccessRule(ImmutableSet.copyOf(operations), ImmutableSet.copyOf(users), true);
    }

    public static AccessRule deny(Set<String> operations, Set<String> users)
    {
        return new AccessRule(ImmutableSet.copyOf(operations), ImmutableSet.copyOf(users), false);
    }

    public static AccessRule forAllUsers(Set<String> operations, boolean allow)
    {
        return new AccessRule(ImmutableSet.copyOf(operations), null, allow);
    }

    /**
     * Parse a single, non-comment line of the access file. The whole line is
     * case-insensitive.
     */
    public static AccessRule parse(String line) throws InvalidLineException
    {
        List<String> parts = FIELDS.splitToList(line.toLowerCase(Locale.US));
        if (parts.size() != 3)
            throw new InvalidLineException(line, String.format("expected 3 fields but found %d", parts.size()));

        boolean allow;
        switch (parts.get(2))
        {
            case "allow":
                allow = true;
                break;
            case "deny":
                allow = false;
                break;
            default:
                throw new InvalidLineException(line, String.format("'%s' is neither allow nor deny", parts.get(2)));
        }

        ImmutableSet<String> operations = ALL.equals(parts.get(0))
                                          ? Commands.ALL
                                          : ImmutableSet.copyOf(TOKENS.split(parts.get(0)));
        ImmutableSet<String> users = ALL.equals(parts.get(1))
                                     ? null
                                     : ImmutableSet.copyOf(TOKENS.split(parts.get(1)));
        return new AccessRule(operations, users, allow);
    }

    public ImmutableSet<String> operations()
    {
        return operations;
    }

    /**
     * @param knownUsers the usernames of all configured accounts
     * @return the users this rule applies to
     */
    public ImmutableSet<String> users(Set<String> knownUsers)
    {
        return users == null ? ImmutableSet.copyOf(knownUsers) : users;
    }

    public boolean appliesToAllUsers()
    {
        return users == null;
    }

    public boolean isAllow()
    {
        return allow;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof AccessRule))
            return false;

        AccessRule rule = (AccessRule) o;
        return allow == rule.allow
               && Objects.equal(operations, rule.operations)
               && Objects.equal(users, rule.users);
    }

    public int hashCode()
    {
        return Objects.hashCode(operations, users, allow);
    }

    public String toString()
    {
        return String.format("%s : %s : %s",
                             Joiner.on(' ').join(operations),
                             users == null ? ALL : Joiner.on(' ').join(users),
                             allow ? "allow" : "deny");
    }
}
