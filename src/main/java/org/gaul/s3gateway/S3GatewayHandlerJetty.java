/*
 * Copyright 2014-2025 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.s3gateway;

import java.io.IOException;
import java.io.InputStream;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Jetty-specific handler for gateway requests. */
final class S3GatewayHandlerJetty extends AbstractHandler {
    private static final Logger logger = LoggerFactory.getLogger(
            S3GatewayHandlerJetty.class);

    private final GatewayPipeline handler;

    S3GatewayHandlerJetty(GatewayPipeline handler) {
        this.handler = handler;
    }

    @Override
    public void handle(String target, Request baseRequest,
            HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        try (InputStream is = request.getInputStream()) {
            handler.doHandle(request, response, is);
            baseRequest.setHandled(true);
        } catch (GatewayException ge) {
            handler.sendSimpleErrorResponse(response, ge.getError(),
                    ge.getMessage());
            baseRequest.setHandled(true);
        } catch (IOException ioe) {
            logger.warn("I/O error handling {} {}: {}", request.getMethod(),
                    request.getRequestURI(), ioe.toString());
            GatewayErrorCode code = GatewayErrorCode.INTERNAL_FAULT;
            handler.sendSimpleErrorResponse(response, code,
                    code.getMessage());
            baseRequest.setHandled(true);
        } catch (RuntimeException re) {
            logger.error("Unexpected exception handling {} {}:",
                    request.getMethod(), request.getRequestURI(), re);
            GatewayErrorCode code = GatewayErrorCode.INTERNAL_FAULT;
            handler.sendSimpleErrorResponse(response, code,
                    code.getMessage());
            baseRequest.setHandled(true);
        }
    }
}
