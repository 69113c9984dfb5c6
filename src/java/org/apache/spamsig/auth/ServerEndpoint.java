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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The (host, port) of a server, as written in the client accounts file. Host
 * names are compared as written, no resolution is performed.
 */
public final class ServerEndpoint
{
    public final String host;
    public final int port;

    public ServerEndpoint(String host, int port)
    {
        Preconditions.checkArgument(host != null && !host.isEmpty(), "Server host must not be empty");
        Preconditions.checkArgument(port >= 0 && port <= 0xFFFF, "Port %s is out of range", port);
        this.host = host;
        this.port = port;
    }

    public boolean equals(Object o)
    {
        if (this == o)
            return true;

        if (!(o instanceof ServerEndpoint))
            return false;

        ServerEndpoint that = (ServerEndpoint) o;
        return port == that.port && host.equals(that.host);
    }

    public int hashCode()
    {
        return Objects.hashCode(host, port);
    }

    public String toString()
    {
        return host + ':' + port;
    }
}
