package com.blogicum.infrastructure.context;

import com.blogicum.domain.model.Actor;
import org.slf4j.MDC;

public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<Actor> currentActor = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(Actor actor, String requestId) {
        currentActor.set(actor);
        currentRequestId.set(requestId);
        actor.user().ifPresent(user -> MDC.put(USER_ID_KEY, user.id().toString()));
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    /**
     * The acting user of the current request; anonymous outside of a request.
     */
    public static Actor getActor() {
        Actor actor = currentActor.get();
        return actor != null ? actor : Actor.anonymous();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentActor.remove();
        currentRequestId.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
