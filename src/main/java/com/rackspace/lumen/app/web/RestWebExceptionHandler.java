/*
 * Copyright 2022 Rackspace US, Inc.
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
package com.rackspace.lumen.app.web;

import com.rackspace.lumen.app.exceptions.StoreFetchException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.error.ErrorAttributeOptions.Include;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@Order(-2)//So that our exception handler gets picked before DefaultErrorWebExceptionHandler
public class RestWebExceptionHandler extends AbstractErrorWebExceptionHandler {

  public RestWebExceptionHandler(
      ErrorAttributes errorAttributes,
      WebProperties webProperties,
      ApplicationContext applicationContext,
      ServerCodecConfigurer serverCodecConfigurer) {
    super(errorAttributes, webProperties.getResources(), applicationContext);
    this.setMessageWriters(serverCodecConfigurer.getWriters());
  }

  @Override
  protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
    return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
  }

  private Mono<ServerResponse> renderErrorResponse(ServerRequest serverRequest) {
    Map<String, Object> body = getErrorAttributes(serverRequest, ErrorAttributeOptions.of(
        Include.EXCEPTION, Include.MESSAGE, Include.STACK_TRACE));
    String exceptionClass = (String) body.get("exception");
    logErrorMessage(serverRequest, (String) body.get("trace"), exceptionClass);
    body.remove("trace");
    return respondWith(body, exceptionClass);
  }

  /**
   * Picks the response status from the exception class present in the error attributes.
   */
  private Mono<ServerResponse> respondWith(Map<String, Object> body, String exceptionClass) {
    if (isInputError(exceptionClass)) {
      return respondWithStatus(body, HttpStatus.BAD_REQUEST);
    }
    if (StoreFetchException.class.getName().equals(exceptionClass)) {
      body.put("message", "Dataset store could not be reached.");
      return respondWithStatus(body, HttpStatus.BAD_GATEWAY);
    }

    body.put("message", "Service encountered an unexpected "
        + "condition which prevented it from fulfilling the request.");
    return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(BodyInserters.fromValue(body));
  }

  private Mono<ServerResponse> respondWithStatus(Map<String, Object> body, HttpStatus status) {
    body.remove("error");
    body.put("status", status.value());
    return ServerResponse.status(status).body(BodyInserters.fromValue(body));
  }

  private void logErrorMessage(ServerRequest serverRequest, String stackTrace,
      String exceptionClass) {
    if (ServerWebInputException.class.getName().equals(exceptionClass)
        || WebExchangeBindException.class.getName().equals(exceptionClass)) {
      // avoid logs cluttering for bad requests
      log.trace("Web request for uri {} failed with exception {}", serverRequest.uri(), stackTrace);
      return;
    }
    log.warn("Web request for uri {} failed with exception {}", serverRequest.uri(), stackTrace);
  }

  private static boolean isInputError(String exceptionClass) {
    return IllegalArgumentException.class.getName().equals(exceptionClass)
        || ServerWebInputException.class.getName().equals(exceptionClass)
        || WebExchangeBindException.class.getName().equals(exceptionClass)
        || TypeMismatchException.class.getName().equals(exceptionClass);
  }
}
