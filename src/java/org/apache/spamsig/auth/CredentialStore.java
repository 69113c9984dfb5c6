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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.spamsig.exceptions.InvalidLineException;
import org.apache.spamsig.utils.LineFiles;

/**
 * Server side accounts, read from a file of {@code username : key} lines.
 *
 * The mapping is loaded by {@link #reload()} and replaced as a whole on each
 * reload, so a reader sees either the previous or the new set of accounts and
 * never a mixture. Until the first reload no accounts are known and only the
 * anonymous user can be served.
 */
public class CredentialStore
{
    private static final Logger logger = LoggerFactory.getLogger(CredentialStore.class);

    private static final Splitter FIELDS = Splitter.on(':').trimResults();

    private final Path accountsFile;
    private final AtomicReference<ImmutableMap<String, String>> accounts = new AtomicReference<>(ImmutableMap.of());

    public CredentialStore(Path accountsFile)
    {
        this.accountsFile = accountsFile;
    }

    public void reload() throws IOException
    {
        accounts.set(loadServerAccounts(accountsFile));
    }

    public Optional<String> getKey(String username)
    {
        return Optional.ofNullable(accounts.get().get(username));
    }

    /**
     * The names of all configured accounts. This is the set of users an access rule
     * for {@code all} users applies to.
     */
    public ImmutableSet<String> usernames()
    {
        return accounts.get().keySet();
    }

    public ImmutableMap<String, String> accounts()
    {
        return accounts.get();
    }

    /**
     * Load the accounts from the specified file.
     *
     * If the file does not exist, an empty mapping is returned. Malformed lines are
     * logged and skipped; when a username appears more than once the last line wins.
     */
    public static ImmutableMap<String, String> loadServerAccounts(Path file) throws IOException
    {
        if (!LineFiles.exists(file))
        {
            logger.info("Accounts file {} does not exist - only the anonymous user will be available", file);
            return ImmutableMap.of();
        }

        Map<String, String> loaded = new LinkedHashMap<>();
        for (String line : LineFiles.readLines(file))
        {
            if (LineFiles.isIgnorable(line))
                continue;

            try
            {
                Map.Entry<String, String> account = parseLine(line);
                logger.debug("Creating an account for {}", account.getKey());
                loaded.put(account.getKey(), account.getValue());
            }
            catch (InvalidLineException e)
            {
                logger.warn("Invalid accounts line: {} ({})", e.getLine(), e.getMessage());
            }
        }

        // usernames only, keys are never logged
        logger.info("Accounts: {}", Joiner.on(',').join(loaded.keySet()));
        return ImmutableMap.copyOf(loaded);
    }

    @VisibleForTesting
    static Map.Entry<String, String> parseLine(String line) throws InvalidLineException
    {
        List<String> parts = FIELDS.splitToList(line);
        if (parts.size() != 2)
            throw new InvalidLineException(line, String.format("expected 2 fields but found %d", parts.size()));

        return Map.entry(parts.get(0), parts.get(1));
    }
}
