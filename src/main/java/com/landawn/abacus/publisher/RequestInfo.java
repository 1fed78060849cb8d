/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.publisher;

import com.landawn.abacus.annotation.MayReturnNull;

/**
 * Client information of the request handled by the current thread, read when audit fields
 * ({@code <event>_ip}, {@code <event>_agent}, {@code <event>_referer}) are filled.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RequestInfo.bind(new RequestInfo(request.getRemoteAddr(), request.getHeader("User-Agent"), request.getHeader("Referer")));
 * try {
 *     chain.doFilter(request, response);
 * } finally {
 *     RequestInfo.unbind();
 * }
 * }</pre>
 *
 * @param clientIp the client IP address
 * @param userAgent the user agent, may be {@code null}
 * @param referer the referer, may be {@code null}
 */
public record RequestInfo(String clientIp, String userAgent, String referer) { // NOSONAR

    private static final ThreadLocal<RequestInfo> requestInfo_TL = new ThreadLocal<>();

    public static void bind(final RequestInfo requestInfo) {
        requestInfo_TL.set(requestInfo);
    }

    public static void unbind() {
        requestInfo_TL.remove();
    }

    @MayReturnNull
    public static RequestInfo current() {
        return requestInfo_TL.get();
    }
}
