/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.netdrive.protocol;

import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import dev.mars.netdrive.simulator.InMemoryProtocolConnector;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(VertxExtension.class)
class ConnectorFactoryTest {

    @TempDir
    Path mountRoot;

    @Test
    void defaultsCoverEveryProtocol(Vertx vertx) throws Exception {
        ConnectorFactory factory = ConnectorFactory.withDefaults(vertx, mountRoot, ConnectorSettings.DEFAULTS);

        assertThat(factory.getSupportedProtocols()).isEqualTo(EnumSet.allOf(Protocol.class));
        assertThat(factory.getConnector(Protocol.FTPS)).isInstanceOf(FtpConnector.class);
        assertThat(factory.getConnector(Protocol.SFTP)).isInstanceOf(SftpConnector.class);
        assertThat(factory.getConnector(Protocol.WEBDAVS)).isInstanceOf(WebDavConnector.class);
        assertThat(factory.getConnector(Protocol.SMB)).isInstanceOf(SmbConnector.class);
        assertThat(factory.getConnector(Protocol.CLOUD)).isInstanceOf(MountedFolderConnector.class);
    }

    @Test
    void unknownProtocolIsUnsupported() {
        ConnectorFactory factory = new ConnectorFactory();

        assertThat(factory.isSupported(Protocol.FTP)).isFalse();
        assertThatThrownBy(() -> factory.getConnector(Protocol.FTP))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.UNSUPPORTED_PROTOCOL));
        assertThatThrownBy(() -> factory.getConnector(null))
                .isInstanceOf(ConnectorException.class);
    }

    @Test
    void registrationReplacesAndUnregisters() throws Exception {
        ConnectorFactory factory = new ConnectorFactory();
        InMemoryProtocolConnector first = new InMemoryProtocolConnector(Protocol.FTP, Protocol.SFTP);
        InMemoryProtocolConnector second = new InMemoryProtocolConnector(Protocol.SFTP);

        factory.register(first);
        factory.register(second);

        assertThat(factory.getConnector(Protocol.FTP)).isSameAs(first);
        assertThat(factory.getConnector(Protocol.SFTP)).isSameAs(second);

        factory.unregister(Protocol.FTP);
        assertThat(factory.getSupportedProtocols()).containsExactly(Protocol.SFTP);
    }
}
