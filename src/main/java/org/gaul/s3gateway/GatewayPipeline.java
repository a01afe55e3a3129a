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

import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Writer;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.net.HttpHeaders;

import org.jclouds.blobstore.domain.Blob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server-independent request pipeline.  Each request moves through
 * validation, identification, rate checking, authorization and routing
 * before anything is sent to a backend account.  Recording the request in
 * the rate limiter is the only mutation before dispatch.
 */
public class GatewayPipeline {
    private static final Logger logger = LoggerFactory.getLogger(
            GatewayPipeline.class);
    private static final String XML_CONTENT_TYPE = "application/xml";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String OCTET_STREAM_CONTENT_TYPE =
            "application/octet-stream";
    private static final String UTF_8 = "UTF-8";
    private static final int BUFFER_SIZE = 8192;
    static final Map<String, String> SECURITY_HEADERS = ImmutableMap.of(
            "X-Content-Type-Options", "nosniff",
            "X-Frame-Options", "DENY",
            "X-XSS-Protection", "1; mode=block",
            "Strict-Transport-Security", "max-age=31536000; includeSubDomains");

    private final IdentityStore identityStore;
    private final AccountRegistry accountRegistry;
    private final RateLimiter rateLimiter;
    private final RequestValidator requestValidator;
    private final XMLOutputFactory xmlOutputFactory =
            XMLOutputFactory.newInstance();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GatewayPipeline(IdentityStore identityStore,
            AccountRegistry accountRegistry, RateLimiter rateLimiter,
            RequestValidator requestValidator) {
        this.identityStore = requireNonNull(identityStore);
        this.accountRegistry = requireNonNull(accountRegistry);
        this.rateLimiter = requireNonNull(rateLimiter);
        this.requestValidator = requireNonNull(requestValidator);
        xmlOutputFactory.setProperty("javax.xml.stream.isRepairingNamespaces",
                Boolean.FALSE);
    }

    public final void doHandle(HttpServletRequest request,
            HttpServletResponse response, InputStream is)
            throws IOException, GatewayException {
        // headers must precede any body bytes, so they go first
        addSecurityHeaders(response);

        String method = request.getMethod();
        String uri = request.getRequestURI();
        logger.debug("request: {} {}", method, uri);

        GatewayRequest gatewayRequest;
        try {
            gatewayRequest = requestValidator.validate(method, uri,
                    request.getContentLengthLong());
        } catch (GatewayException ge) {
            logger.warn("rejected {} {}: {}", method, uri, ge.getMessage());
            throw ge;
        }

        var context = new RequestContext(method, gatewayRequest);
        try {
            dispatch(context, request, response, is);
        } catch (GatewayException ge) {
            logger.warn("rejected {}: {} {}", context, ge.getError(),
                    ge.getMessage());
            throw ge;
        }
    }

    private void dispatch(RequestContext context, HttpServletRequest request,
            HttpServletResponse response, InputStream is)
            throws IOException, GatewayException {
        Identity identity = identityStore.resolveIdentity(
                request.getHeader(S3GatewayConstants.API_KEY_HEADER));
        context.setIdentity(identity);

        if (!rateLimiter.admit(identity.getUsername())) {
            throw new GatewayException(GatewayErrorCode.INVALID_REQUEST,
                    "Rate limit exceeded");
        }

        AccessController.authorize(identity, context.getBucket(),
                context.getOperation());

        BlobStoreClient client = accountRegistry.locateClient(
                context.getBucket());

        switch (context.getOperation()) {
        case LIST_OBJECTS:
            handleListObjects(request, response, client, context.getBucket());
            break;
        case GET_OBJECT:
            handleGetObject(response, client, context.getBucket(),
                    context.getKey());
            break;
        case PUT_OBJECT:
            handlePutObject(request, response, is, client,
                    context.getBucket(), context.getKey());
            break;
        default:
            throw new GatewayException(GatewayErrorCode.INTERNAL_FAULT,
                    "Unknown operation: " + context.getOperation());
        }

        logger.info("Authenticated user: {} with role: {} {}",
                identity.getUsername(), identity.getRole(), context);
    }

    private void handleListObjects(HttpServletRequest request,
            HttpServletResponse response, BlobStoreClient client,
            String bucket) throws IOException, GatewayException {
        String prefix = request.getParameter("prefix");
        List<ObjectSummary> objects = client.listObjects(bucket, prefix);

        response.setStatus(HttpServletResponse.SC_OK);
        response.setCharacterEncoding(UTF_8);
        response.setContentType(XML_CONTENT_TYPE);
        try (Writer writer = response.getWriter()) {
            XMLStreamWriter xml = xmlOutputFactory.createXMLStreamWriter(
                    writer);
            xml.writeStartDocument();
            xml.writeStartElement("ListBucketResult");

            writeSimpleElement(xml, "Name", bucket);
            if (prefix == null) {
                xml.writeEmptyElement("Prefix");
            } else {
                writeSimpleElement(xml, "Prefix", prefix);
            }

            for (ObjectSummary object : objects) {
                xml.writeStartElement("Contents");
                writeSimpleElement(xml, "Key", object.getKey());
                writeSimpleElement(xml, "Size",
                        String.valueOf(object.getSize()));
                Date lastModified = object.getLastModified();
                if (lastModified == null) {
                    xml.writeEmptyElement("LastModified");
                } else {
                    writeSimpleElement(xml, "LastModified",
                            formatDate(lastModified));
                }
                xml.writeEndElement();
            }

            xml.writeEndElement();
            xml.flush();
        } catch (XMLStreamException xse) {
            throw new IOException(xse);
        }
    }

    private static void handleGetObject(HttpServletResponse response,
            BlobStoreClient client, String bucket, String key)
            throws IOException, GatewayException {
        Blob blob = client.getObject(bucket, key);

        InputStream is;
        try {
            is = blob.getPayload().openStream();
        } catch (IOException ioe) {
            throw backendReadFault(bucket, key, ioe);
        }
        try (InputStream backend = is) {
            // status is only sent once the backend has produced data
            byte[] buffer = new byte[BUFFER_SIZE];
            int count = readBackend(backend, buffer, bucket, key);

            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType(OCTET_STREAM_CONTENT_TYPE);
            Long contentLength = blob.getMetadata().getContentMetadata()
                    .getContentLength();
            if (contentLength != null) {
                response.setContentLengthLong(contentLength);
            }

            OutputStream os = response.getOutputStream();
            while (count != -1) {
                os.write(buffer, 0, count);
                count = readBackend(backend, buffer, bucket, key);
            }
            os.flush();
        }
    }

    private static int readBackend(InputStream is, byte[] buffer,
            String bucket, String key) throws GatewayException {
        try {
            return is.read(buffer);
        } catch (IOException ioe) {
            throw backendReadFault(bucket, key, ioe);
        }
    }

    private static GatewayException backendReadFault(String bucket,
            String key, IOException cause) {
        logger.warn("backend GetObject read failed for {}/{}: {}", bucket,
                key, cause.toString());
        return new GatewayException(GatewayErrorCode.BACKEND_FAULT,
                "Backend GetObject error", cause);
    }

    private void handlePutObject(HttpServletRequest request,
            HttpServletResponse response, InputStream is,
            BlobStoreClient client, String bucket, String key)
            throws IOException, GatewayException {
        long contentLength = request.getContentLengthLong();
        InputStream payload = is;
        if (contentLength < 0) {
            // chunked upload; buffer at most one byte past the ceiling
            byte[] body = ByteStreams.toByteArray(ByteStreams.limit(is,
                    requestValidator.getMaxPayloadSize() + 1));
            requestValidator.checkPayloadSize(body.length);
            contentLength = body.length;
            payload = new ByteArrayInputStream(body);
        }

        client.putObject(bucket, key, payload, contentLength,
                request.getHeader(HttpHeaders.CONTENT_TYPE));

        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentLength(0);
    }

    static void addSecurityHeaders(HttpServletResponse response) {
        for (Map.Entry<String, String> entry : SECURITY_HEADERS.entrySet()) {
            response.setHeader(entry.getKey(), entry.getValue());
        }
    }

    protected final void sendSimpleErrorResponse(
            HttpServletResponse response, GatewayErrorCode code,
            String message) throws IOException {
        logger.debug("sendSimpleErrorResponse: {} {}", code, message);

        if (response.isCommitted()) {
            // Body already partially streamed to the client.
            return;
        }

        addSecurityHeaders(response);
        response.setStatus(code.getHttpStatusCode());
        response.setCharacterEncoding(UTF_8);
        response.setContentType(JSON_CONTENT_TYPE);
        try (Writer writer = response.getWriter()) {
            objectMapper.writeValue(writer, objectMapper.createObjectNode()
                    .put("error", message)
                    .put("status", code.getHttpStatusCode()));
        }
    }

    private static void writeSimpleElement(XMLStreamWriter xml,
            String elementName, String characters) throws XMLStreamException {
        xml.writeStartElement(elementName);
        xml.writeCharacters(characters);
        xml.writeEndElement();
    }

    private static String formatDate(Date date) {
        SimpleDateFormat formatter = new SimpleDateFormat(
                "yyyy-MM-dd'T'HH:mm:ss'Z'");
        formatter.setTimeZone(TimeZone.getTimeZone("GMT"));
        return formatter.format(date);
    }
}
