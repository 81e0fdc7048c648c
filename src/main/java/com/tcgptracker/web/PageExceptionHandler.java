package com.tcgptracker.web;

import com.tcgptracker.common.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.json.MappingJackson2JsonView;

import java.util.Map;

/**
 * Renders the error page for failures on server-rendered pages.
 * Script requests to those pages (header {@code X-Requested-With: XMLHttpRequest}) get the
 * same {@code {"error","status"}} body as the JSON endpoints, which are handled by
 * {@code GlobalExceptionHandler}.
 */
@ControllerAdvice(basePackages = "com.tcgptracker.web")
@RequiredArgsConstructor
@Slf4j
public class PageExceptionHandler {

    static final String REQUESTED_WITH_HEADER = "X-Requested-With";
    static final String XML_HTTP_REQUEST = "XMLHttpRequest";

    private final SiteModelAdvice siteModelAdvice;

    @ExceptionHandler({CardNotFoundException.class, SetNotFoundException.class,
        UserNotFoundException.class, FriendRequestNotFoundException.class,
        GenerationNotFoundException.class, RarityProbabilityNotFoundException.class})
    public ModelAndView handleNotFound(TrackerException e, HttpServletRequest request, HttpServletResponse response) {
        return errorPage(HttpStatus.NOT_FOUND, e.getMessage(), request, response);
    }

    @ExceptionHandler({InvalidCollectionActionException.class, InvalidProbabilityException.class,
        IllegalArgumentException.class})
    public ModelAndView handleBadRequest(RuntimeException e, HttpServletRequest request, HttpServletResponse response) {
        return errorPage(HttpStatus.BAD_REQUEST, e.getMessage(), request, response);
    }

    @ExceptionHandler(TrackerException.class)
    public ModelAndView handleTrackerException(TrackerException e, HttpServletRequest request,
                                               HttpServletResponse response) {
        log.error("Request {} failed", request.getRequestURI(), e);
        return errorPage(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), request, response);
    }

    private ModelAndView errorPage(HttpStatus status, String message,
                                   HttpServletRequest request, HttpServletResponse response) {
        log.debug("{} on {}: {}", status.value(), request.getRequestURI(), message);
        if (isScriptRequest(request)) {
            ModelAndView json = new ModelAndView(new MappingJackson2JsonView(),
                Map.of("error", message != null ? message : status.getReasonPhrase(), "status", String.valueOf(status.value())));
            json.setStatus(status);
            return json;
        }
        ModelAndView mav = new ModelAndView("error");
        mav.setStatus(status);
        mav.addAllObjects(siteModelAdvice.siteAttributes(request, response));
        mav.addObject("status", status.value());
        mav.addObject("reason", status.getReasonPhrase());
        mav.addObject("message", message);
        return mav;
    }

    static boolean isScriptRequest(HttpServletRequest request) {
        return XML_HTTP_REQUEST.equals(request.getHeader(REQUESTED_WITH_HEADER));
    }
}
