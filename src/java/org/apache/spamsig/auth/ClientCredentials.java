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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.spamsig.exceptions.InvalidLineException;
import org.apache.spamsig.utils.LineFiles;

/**
 * Client side accounts, one per server. The file has the layout
 * {@code host : port : username : salt,key} where the salt and key are hex
 * encoded (see {@link KeyMaterial}).
 *
 * Servers without a configured account are contacted as {@link Account#ANONYMOUS}.
 */
public class ClientCredentials
{
    private static final Logger logger = LoggerFactory.getLogger(ClientCredentials.class);

    private static final Splitter FIELDS = Splitter.on(':').trimResults();

    private final ImmutableMap<ServerEndpoint, Account> accounts;

    public ClientCredentials(Map<ServerEndpoint, Account> accounts)
    {
        this.accounts = ImmutableMap.copyOf(accounts);
    }

    public static ClientCredentials load(Path file) throws IOException
    {
        return new ClientCredentials(loadClientAccounts(file));
    }

    public Account accountFor(String host, int port)
    {
        return accounts.getOrDefault(new ServerEndpoint(host, port), Account.ANONYMOUS);
    }

    public ImmutableMap<ServerEndpoint, Account> asMap()
    {
        return accounts;
    }

    /**
     * Every line fails independently: a line with the wrong number of fields, a
     * port which is not a number, unusable key material or an account which cannot
     * be constructed is logged and skipped. Later lines for the same server replace
     * earlier ones.
     */
    public static ImmutableMap<ServerEndpoint, Account> loadClientAccounts(Path file) throws IOException
    {
        if (!LineFiles.exists(file))
        {
            logger.warn("No accounts are setup. All commands will be executed by the anonymous user.");
            return ImmutableMap.of();
        }

        Map<ServerEndpoint, Account> loaded = new LinkedHashMap<>();
        List<String> lines = LineFiles.readLines(file);
        for (int lineno = 0; lineno < lines.size(); lineno++)
        {
            String line = lines.get(lineno).trim();
            if (LineFiles.isIgnorable(line))
                continue;

            try
            {
                Map.Entry<ServerEndpoint, Account> entry = parseLine(line);
                loaded.put(entry.getKey(), entry.getValue());
            }
            catch (InvalidLineException e)
            {
                logger.warn("account file: invalid line {}: {}", lineno + 1, e.getMessage());
            }
        }
        return ImmutableMap.copyOf(loaded);
    }

    @VisibleForTesting
    static Map.Entry<ServerEndpoint, Account> parseLine(String line) throws InvalidLineException
    {
        List<String> parts = FIELDS.splitToList(line);
        if (parts.size() != 4)
            throw new InvalidLineException(line, "wrong number of parts");

        int port;
        try
        {
            port = Integer.parseInt(parts.get(1));
        }
        catch (NumberFormatException e)
        {
            throw new InvalidLineException(line, String.format("invalid port '%s'", parts.get(1)));
        }

        KeyMaterial material;
        try
        {
            material = KeyMaterial.fromHex(parts.get(3));
        }
        catch (IllegalArgumentException e)
        {
            throw new InvalidLineException(line, e.getMessage());
        }

        if (material.isEmpty())
            throw new InvalidLineException(line, "keystuff can't be all empty");

        try
        {
            ServerEndpoint endpoint = new ServerEndpoint(parts.get(0), port);
            return Map.entry(endpoint, new Account(parts.get(2), material.getSalt(), material.getKey()));
        }
        catch (IllegalArgumentException e)
        {
            throw new InvalidLineException(line, e.getMessage());
        }
    }
}
