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
package org.apache.spamsig.config;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.spamsig.auth.AccessPolicyEngine;
import org.apache.spamsig.auth.AuthManager;
import org.apache.spamsig.auth.CredentialStore;
import org.apache.spamsig.db.DigestStore;
import org.apache.spamsig.db.IDigestBackend;
import org.apache.spamsig.exceptions.ConfigurationException;

/**
 * Builds the server's components from a {@link Config}: the credential store and
 * access policy behind an {@link AuthManager}, and the {@link DigestStore} over the
 * configured backend. {@link #init()} loads the accounts and access files and
 * starts the store's background tasks.
 */
public class ServerDescriptor
{
    private static final Logger logger = LoggerFactory.getLogger(ServerDescriptor.class);

    private final Config config;
    private final AuthManager authManager;
    private final DigestStore digestStore;

    private ServerDescriptor(Config config, AuthManager authManager, DigestStore digestStore)
    {
        this.config = config;
        this.authManager = authManager;
        this.digestStore = digestStore;
    }

    public static ServerDescriptor load(ConfigurationLoader loader) throws ConfigurationException
    {
        return create(loader.loadConfig());
    }

    public static ServerDescriptor create(Config config) throws ConfigurationException
    {
        logger.info("Server configuration: {}", config);
        if (config.reorganize_period_seconds <= 0)
            throw new ConfigurationException("reorganize_period_seconds must be positive, but was " +
                                             config.reorganize_period_seconds);

        CredentialStore credentials = new CredentialStore(toPath(config.accounts_file));
        AccessPolicyEngine policy = new AccessPolicyEngine(toPath(config.access_file), credentials::usernames);
        IDigestBackend backend = constructBackend(config.digest_backend);
        DigestStore store = new DigestStore(config.digest_store_name, backend, config.reorganize_period_seconds);
        return new ServerDescriptor(config, new AuthManager(credentials, policy), store);
    }

    public void init() throws ConfigurationException
    {
        try
        {
            authManager.reload();
        }
        catch (IOException e)
        {
            throw new ConfigurationException("Unable to read the accounts or access file", e);
        }
        digestStore.startReorganizing(config.digest_max_age_seconds);
        digestStore.startSyncing(config.sync_period_seconds);
    }

    /**
     * Re-read the accounts and access files. A failure leaves the previously loaded
     * mappings in place.
     */
    public void reload() throws IOException
    {
        logger.info("Reloading accounts and access rules");
        authManager.reload();
    }

    public void shutdown() throws IOException
    {
        digestStore.shutdown();
    }

    public Config getConfig()
    {
        return config;
    }

    public AuthManager getAuthManager()
    {
        return authManager;
    }

    public DigestStore getDigestStore()
    {
        return digestStore;
    }

    private static Path toPath(String file)
    {
        return file == null ? null : Paths.get(file);
    }

    @VisibleForTesting
    static IDigestBackend constructBackend(String className) throws ConfigurationException
    {
        if (className == null)
            throw new ConfigurationException("digest_backend must be set");

        Class<?> cls;
        try
        {
            cls = Class.forName(className);
        }
        catch (ClassNotFoundException e)
        {
            throw new ConfigurationException(String.format("Unable to find digest backend class '%s'", className), e);
        }

        if (!IDigestBackend.class.isAssignableFrom(cls))
            throw new ConfigurationException(String.format("%s is not an %s", className, IDigestBackend.class.getSimpleName()));

        try
        {
            return (IDigestBackend) cls.getDeclaredConstructor().newInstance();
        }
        catch (InvocationTargetException e)
        {
            throw new ConfigurationException(String.format("Digest backend %s failed to open", className), e.getCause());
        }
        catch (ReflectiveOperationException e)
        {
            throw new ConfigurationException(String.format("Unable to instantiate digest backend %s; it needs a " +
                                                           "public no-arg constructor", className), e);
        }
    }
}
