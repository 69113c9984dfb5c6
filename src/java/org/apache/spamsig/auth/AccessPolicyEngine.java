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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.spamsig.exceptions.InvalidLineException;
import org.apache.spamsig.utils.LineFiles;

/**
 * Holds the access policy compiled from the access file and answers whether a
 * user may run a command.
 *
 * Policy checks read an immutable {@link AccessPolicy} through an atomic reference,
 * so they need no locking. {@link #reload()} compiles a complete new policy before
 * swapping it in. Until the first reload every command is denied.
 */
public class AccessPolicyEngine
{
    private static final Logger logger = LoggerFactory.getLogger(AccessPolicyEngine.class);

    private final Path accessFile;
    private final Supplier<? extends Set<String>> knownUsers;
    private final AtomicReference<AccessPolicy> policy = new AtomicReference<>(AccessPolicy.empty());

    /**
     * @param accessFile location of the access file, which need not exist
     * @param knownUsers supplies the current account names each time the policy is compiled
     */
    public AccessPolicyEngine(Path accessFile, Supplier<? extends Set<String>> knownUsers)
    {
        this.accessFile = accessFile;
        this.knownUsers = knownUsers;
    }

    public void reload() throws IOException
    {
        AccessPolicy loaded = loadRules(accessFile, knownUsers.get());
        AccessPolicy previous = policy.getAndSet(loaded);
        if (!previous.equals(loaded))
            logger.debug("Access policy changed from {} to {}", previous, loaded);
    }

    public AccessPolicy currentPolicy()
    {
        return policy.get();
    }

    public boolean isAllowed(String username, String command)
    {
        return query(policy.get(), username, command);
    }

    public static boolean query(AccessPolicy acl, String username, String command)
    {
        return acl.isAllowed(username, command);
    }

    /**
     * Load the access file and compile it against the given accounts. If the file
     * does not exist the {@link AccessPolicy#defaultPolicy() default policy} is used.
     * Invalid lines are logged and skipped.
     */
    public static AccessPolicy loadRules(Path file, Set<String> knownUsers) throws IOException
    {
        if (!LineFiles.exists(file))
        {
            logger.info("Using default ACL: the anonymous user may use the check, report, ping, pong and info commands");
            return AccessPolicy.defaultPolicy();
        }

        AccessPolicy acl = AccessPolicy.compile(parseRules(LineFiles.readLines(file)), knownUsers);
        logger.info("ACL: {}", acl.asMap());
        return acl;
    }

    @VisibleForTesting
    static ImmutableList<AccessRule> parseRules(List<String> lines)
    {
        List<AccessRule> rules = new ArrayList<>(lines.size());
        for (String line : lines)
        {
            if (LineFiles.isIgnorable(line))
                continue;

            try
            {
                rules.add(AccessRule.parse(line));
            }
            catch (InvalidLineException e)
            {
                logger.warn("Invalid ACL line: {} ({})", e.getLine(), e.getMessage());
            }
        }
        return ImmutableList.copyOf(rules);
    }
}
