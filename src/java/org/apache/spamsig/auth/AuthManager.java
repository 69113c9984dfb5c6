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
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.spamsig.metrics.AuthMetrics;

/**
 * Entry point for the request handling layer: looks up the key a request must be
 * signed with and decides whether the requesting user may run a command.
 */
public class AuthManager
{
    private static final Logger logger = LoggerFactory.getLogger(AuthManager.class);

    private final CredentialStore credentials;
    private final AccessPolicyEngine policy;

    public AuthManager(CredentialStore credentials, AccessPolicyEngine policy)
    {
        this.credentials = credentials;
        this.policy = policy;
    }

    /**
     * Reload the accounts and then the access file, which is compiled against the
     * newly loaded accounts.
     */
    public void reload() throws IOException
    {
        credentials.reload();
        policy.reload();
        AuthMetrics.instance.markReload();
    }

    /**
     * @return the key of the named account, or empty if there is no such account.
     * The anonymous user has no key as its requests are not signed.
     */
    public Optional<String> authenticate(String username)
    {
        if (Account.ANONYMOUS_USER.equals(username))
            return Optional.empty();

        Optional<String> key = credentials.getKey(username);
        if (key.isPresent())
        {
            AuthMetrics.instance.markSuccess();
        }
        else
        {
            logger.debug("Unknown user {}", username);
            AuthMetrics.instance.markFailure();
        }
        return key;
    }

    public boolean authorize(String username, String command)
    {
        boolean allowed = policy.isAllowed(username, command);
        if (!allowed)
        {
            logger.debug("User {} is not permitted to run {}", username, command);
            AuthMetrics.instance.markDenied();
        }
        return allowed;
    }

    public CredentialStore getCredentialStore()
    {
        return credentials;
    }

    public AccessPolicyEngine getAccessPolicyEngine()
    {
        return policy;
    }
}
