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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

/**
 * Credentials a client uses to sign requests to one server: a username plus the
 * key derived for it and the optional salt the key was derived with.
 */
public final class Account
{
    public static final String ANONYMOUS_USER = "anonymous";

    /**
     * Identity used when no account is configured for a server. Anonymous requests
     * are not signed, so the key is empty.
     */
    public static final Account ANONYMOUS = new Account(ANONYMOUS_USER, null, new byte[0], false);

    private final String username;
    private final byte[] salt;
    private final byte[] key;

    public Account(String username, byte[] salt, byte[] key)
    {
        this(username, salt, key, true);
    }

    private Account(String username, byte[] salt, byte[] key, boolean validate)
    {
        if (validate)
        {
            Preconditions.checkArgument(StringUtils.isNotBlank(username), "Account username must not be empty");
            Preconditions.checkArgument(key != null && key.length > 0, "Account %s has no key", username);
        }
        this.username = username;
        this.salt = salt == null ? null : salt.clone();
        this.key = key.clone();
    }

    public String getUsername()
    {
        return username;
    }

    /**
     * @return the salt, or null if the key was configured without one
     */
    public byte[] getSalt()
    {
        return salt == null ? null : salt.clone();
    }

    public byte[] getKey()
    {
        return key.clone();
    }

    public boolean isAnonymous()
    {
        return ANONYMOUS_USER.equals(username);
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof Account))
            return false;

        Account that = (Account) o;
        return username.equals(that.username)
               && Arrays.equals(salt, that.salt)
               && Arrays.equals(key, that.key);
    }

    public int hashCode()
    {
        return 31 * (31 * username.hashCode() + Arrays.hashCode(salt)) + Arrays.hashCode(key);
    }

    // keys stay out of logs
    public String toString()
    {
        return String.format("Account(%s)", username);
    }
}
