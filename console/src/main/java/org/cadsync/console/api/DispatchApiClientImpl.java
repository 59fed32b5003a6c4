package org.cadsync.console.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.ResponseBody;
import org.cadsync.console.api.dto.AuditEventDto;
import org.cadsync.console.api.dto.CallDto;
import org.cadsync.console.api.dto.UnitsResponseDto;
import org.cadsync.console.domain.model.AuditEvent;
import org.cadsync.console.domain.model.CallStatus;
import org.cadsync.console.domain.model.Unit;
import org.cadsync.console.queue.QueuedMutationException;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.Path;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based implementation of DispatchApiClient.
 */
public final class DispatchApiClientImpl implements DispatchApiClient {

    private static final Logger LOG = Logger.getLogger(DispatchApiClientImpl.class.getName());
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final DispatchApiService api;

    public DispatchApiClientImpl(String baseUrl, OkHttpClient client) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(client, "client must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(OBJECT_MAPPER))
                .client(client)
                .build();

        this.api = retrofit.create(DispatchApiService.class);
    }

    @Override
    public List<org.cadsync.console.domain.model.Call> fetchCalls() throws DispatchException {
        List<CallDto> dtos = execute(api.getCalls(), "GET /api/cad/calls");
        return DtoMapper.toCalls(dtos);
    }

    @Override
    public List<Unit> fetchUnits() throws DispatchException {
        UnitsResponseDto response = execute(api.getUnits(), "GET /api/cad/units");
        return DtoMapper.toUnits(response == null ? null : response.getActiveUnits());
    }

    @Override
    public List<AuditEvent> fetchAuditEvents() throws DispatchException {
        List<AuditEventDto> dtos = execute(api.getEvents(), "GET /api/events");
        return DtoMapper.toAuditEvents(dtos);
    }

    @Override
    public void assignUnit(String callId, String unitId) throws DispatchException {
        AssignUnitRequest request = new AssignUnitRequest(callId, unitId);
        DispatchResponse response = execute(api.dispatch(request), "POST /api/cad/dispatch");
        if (response != null) {
            LOG.fine(() -> String.format("[API] Dispatch of %s to call %s acknowledged: %s (eta=%s)",
                    unitId, callId, response.getStatus(), response.getEtaMinutes()));
        }
    }

    @Override
    public void transitionStatus(String callId, CallStatus status, String unitId) throws DispatchException {
        Objects.requireNonNull(status, "status must not be null");
        StatusRequest request = new StatusRequest(status.getWireName(), unitId);
        executeVoid(api.updateCallStatus(callId, request), "POST /api/cad/calls/{id}/status");
    }

    /**
     * Execute a Retrofit call and return the body, classifying every failure.
     */
    private <T> T execute(Call<T> call, String description) throws DispatchException {
        Response<T> response;
        try {
            response = call.execute();
        } catch (QueuedMutationException e) {
            LOG.warning(() -> "[API] " + description + " not delivered: " + e.getMessage());
            throw DispatchException.queued(e.getMessage(), e.getEntryId(), e);
        } catch (CredentialException e) {
            LOG.warning(() -> "[API] " + description + " not sent: " + e.getMessage());
            throw DispatchException.auth(description + " not sent: " + e.getMessage(), e);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            throw DispatchException.network(description + " failed: " + e.getMessage(), e);
        }
        if (response.isSuccessful()) {
            return response.body();
        }
        String detail = readErrorDetail(response);
        LOG.warning(() -> String.format("[API] %s failed: %d %s", description, response.code(), detail));
        throw DispatchException.fromStatus(response.code(), description + " failed: " + response.code() + " " + detail);
    }

    private void executeVoid(Call<Void> call, String description) throws DispatchException {
        execute(call, description);
    }

    /**
     * Pull the server's "detail" text out of an error body, falling back to the HTTP reason.
     */
    private static String readErrorDetail(Response<?> response) {
        ResponseBody errorBody = response.errorBody();
        if (errorBody == null) {
            return response.message();
        }
        try {
            String raw = errorBody.string();
            if (raw.isEmpty()) {
                return response.message();
            }
            JsonNode root = OBJECT_MAPPER.readTree(raw);
            JsonNode detail = root.path("detail");
            if (detail.isTextual()) {
                return detail.asText();
            }
            return detail.isMissingNode() ? raw : detail.toString();
        } catch (IOException e) {
            LOG.log(Level.FINE, "[API] Unreadable error body", e);
            return response.message();
        }
    }

    /**
     * Retrofit service interface for the dispatch API.
     */
    interface DispatchApiService {
        @GET("api/cad/calls")
        Call<List<CallDto>> getCalls();

        @GET("api/cad/units")
        Call<UnitsResponseDto> getUnits();

        @GET("api/events")
        Call<List<AuditEventDto>> getEvents();

        @POST("api/cad/dispatch")
        Call<DispatchResponse> dispatch(@Body AssignUnitRequest request);

        @POST("api/cad/calls/{callId}/status")
        Call<Void> updateCallStatus(@Path("callId") String callId, @Body StatusRequest request);
    }

    /**
     * Request DTO for assigning a unit.
     */
    static final class AssignUnitRequest {
        @JsonProperty("call_id")
        private final String callId;

        @JsonProperty("unit_identifier")
        private final String unitIdentifier;

        AssignUnitRequest(String callId, String unitIdentifier) {
            this.callId = callId;
            this.unitIdentifier = unitIdentifier;
        }

        public String getCallId() {
            return callId;
        }

        public String getUnitIdentifier() {
            return unitIdentifier;
        }
    }

    /**
     * Request DTO for status transitions.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class StatusRequest {
        @JsonProperty("status")
        private final String status;

        @JsonProperty("unit_identifier")
        private final String unitIdentifier;

        StatusRequest(String status, String unitIdentifier) {
            this.status = status;
            this.unitIdentifier = unitIdentifier;
        }

        public String getStatus() {
            return status;
        }

        public String getUnitIdentifier() {
            return unitIdentifier;
        }
    }

    /**
     * Response DTO of a dispatch.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class DispatchResponse {
        @JsonProperty("status")
        private String status;

        @JsonProperty("eta_minutes")
        private Integer etaMinutes;

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public Integer getEtaMinutes() {
            return etaMinutes;
        }

        public void setEtaMinutes(Integer etaMinutes) {
            this.etaMinutes = etaMinutes;
        }
    }
}
