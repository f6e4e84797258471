package com.playfactory.provisioning;

import java.util.LinkedHashMap;

/**
 * Scaffold for Node.js game modules.
 *
 * <p>The user module is expected to export {@code initGame()} and
 * {@code handlePlayerAction(state, action, data)}. Code without a {@code module.exports}
 * assignment is wrapped so that top-level functions with those names are exported, with a
 * click-counter fallback for anything missing. The generated server broadcasts state over
 * socket.io, registers with the matchmaker on start and heartbeats until it is stopped.
 */
public class NodeServerScaffold implements ServerScaffold {

    static final String SERVER_FILE = "server.js";
    static final String USER_FILE = "user_game.js";
    static final String PACKAGE_FILE = "package.json";

    private static final String PACKAGE_JSON = """
            {
              "name": "game-server",
              "version": "1.0.0",
              "main": "server.js",
              "scripts": { "start": "node server.js" },
              "dependencies": {
                "express": "^4.18.2",
                "socket.io": "^4.7.2",
                "axios": "^1.6.0"
              }
            }
            """;

    private static final String USER_WRAPPER = """
            // user game code
            {{USER_CODE}}

            module.exports = {
                initGame: typeof initGame !== 'undefined' ? initGame : () => ({ clickCount: 0 }),
                handlePlayerAction: typeof handlePlayerAction !== 'undefined' ? handlePlayerAction :
                    (gameState, action) => {
                        if (action === 'click') {
                            gameState.clickCount = (gameState.clickCount || 0) + 1;
                        }
                        return gameState;
                    }
            };
            """;

    private static final String SERVER_JS = """
            const express = require('express');
            const http = require('http');
            const socketIo = require('socket.io');
            const axios = require('axios');

            const app = express();
            const server = http.createServer(app);
            const io = socketIo(server, { cors: { origin: '*', methods: ['GET', 'POST'] } });

            const PORT = parseInt(process.env.PORT) || 8080;
            const PUBLIC_HOST = process.env.PUBLIC_HOST || 'localhost';
            const PUBLIC_PORT = parseInt(process.env.PUBLIC_PORT) || PORT;
            const MATCHMAKER_URL = process.env.MATCHMAKER_URL || 'http://localhost:8000';
            const ROOM_NAME = process.env.ROOM_NAME || {{ROOM_NAME}};
            const MAX_PLAYERS = parseInt(process.env.MAX_PLAYERS) || 20;
            const HEARTBEAT_INTERVAL = parseInt(process.env.HEARTBEAT_INTERVAL) || 10000;
            const RETRY_INTERVAL = parseInt(process.env.RETRY_INTERVAL) || 5000;

            const game = require('./user_game.js');
            let gameState = game.initGame ? game.initGame() : { clickCount: 0 };
            let connectedPlayers = 0;
            let serverId = process.env.SERVER_ID || null;
            let registered = false;

            app.get('/health', (req, res) => {
                res.json({ status: 'healthy', room: ROOM_NAME, players: connectedPlayers });
            });

            io.on('connection', (socket) => {
                connectedPlayers++;
                socket.emit('gameState', gameState);
                socket.on('playerAction', (data) => {
                    try {
                        gameState = game.handlePlayerAction(gameState, data.action, data);
                        io.emit('gameState', gameState);
                    } catch (error) {
                        console.error('playerAction failed:', error);
                        socket.emit('error', { message: 'action failed' });
                    }
                });
                socket.on('disconnect', () => { connectedPlayers--; });
            });

            async function register() {
                const response = await axios.post(`${MATCHMAKER_URL}/api/v1/matchmaker/register`, {
                    server_id: serverId,
                    ip: PUBLIC_HOST,
                    port: PUBLIC_PORT,
                    name: ROOM_NAME,
                    max_players: MAX_PLAYERS,
                    current_players: connectedPlayers,
                    metadata: { created_by: 'playfactory', game_type: 'custom' }
                });
                serverId = response.data.server_id;
                registered = true;
                console.log(`registered with matchmaker as ${serverId}`);
            }

            async function heartbeat() {
                try {
                    if (!registered) {
                        await register();
                    } else {
                        await axios.post(`${MATCHMAKER_URL}/api/v1/matchmaker/heartbeat/${encodeURIComponent(serverId)}`,
                            { current_players: connectedPlayers });
                    }
                    setTimeout(heartbeat, HEARTBEAT_INTERVAL);
                } catch (error) {
                    if (error.response && error.response.status === 404) {
                        registered = false;
                    }
                    console.error('heartbeat failed:', error.message);
                    setTimeout(heartbeat, RETRY_INTERVAL);
                }
            }

            server.listen(PORT, () => {
                console.log(`game server '${ROOM_NAME}' listening on ${PORT}`);
                heartbeat();
            });

            process.on('SIGTERM', () => {
                const done = () => server.close(() => process.exit(0));
                if (!registered) return done();
                axios.delete(`${MATCHMAKER_URL}/api/v1/matchmaker/servers/${encodeURIComponent(serverId)}`)
                    .catch(() => {})
                    .finally(done);
            });
            """;

    private static final String DOCKERFILE = """
            FROM node:18-alpine
            WORKDIR /usr/src/app
            COPY package.json ./
            RUN npm install --omit=dev
            COPY server.js user_game.js ./
            EXPOSE 8080
            ENV NODE_ENV=production
            CMD ["node", "{{ENTRYPOINT}}"]
            """;

    @Override
    public DeployableUnit wrap(String userCode, String serverName) {
        var files = new LinkedHashMap<String, String>();
        files.put(PACKAGE_FILE, PACKAGE_JSON);
        files.put(SERVER_FILE, SERVER_JS.replace("{{ROOM_NAME}}", jsString(serverName)));
        files.put(USER_FILE, prepareUserCode(userCode));
        return new DeployableUnit(files, SERVER_FILE);
    }

    @Override
    public String buildDescriptor(DeployableUnit unit, String serverName) {
        return DOCKERFILE.replace("{{ENTRYPOINT}}", unit.entrypoint());
    }

    static String prepareUserCode(String userCode) {
        if (userCode.contains("module.exports")) {
            return userCode;
        }
        return USER_WRAPPER.replace("{{USER_CODE}}", userCode);
    }

    /**
     * Renders a value as a single-quoted JavaScript string literal.
     */
    static String jsString(String value) {
        var sb = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '`' -> sb.append("\\`");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('\'').toString();
    }
}
