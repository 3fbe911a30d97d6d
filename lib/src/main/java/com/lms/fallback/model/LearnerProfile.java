package com.lms.fallback.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Learner profile record keyed by tenant and LTI user id.
 * JSON field names are shared with the primary store rows and the cache mirror.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LearnerProfile {
    
    public static final String ENTITY_TYPE = "learner";
    
    public static final EntityDescriptor<LearnerProfile> DESCRIPTOR = EntityDescriptor.of(
            ENTITY_TYPE, LearnerProfile.class, LearnerProfile::getTenantId, LearnerProfile::getLtiUserId);
    
    private final String id;
    private final String tenantId;
    private final String ltiUserId;
    private final String ltiDeploymentId;
    private final String email;
    private final String name;
    private final CognitiveProfile cognitiveProfile;
    private final PrivacySettings privacySettings;
    private final String createdAt;
    private final String updatedAt;
    
    @JsonCreator
    public LearnerProfile(@JsonProperty("id") String id,
                          @JsonProperty("tenant_id") String tenantId,
                          @JsonProperty("lti_user_id") String ltiUserId,
                          @JsonProperty("lti_deployment_id") String ltiDeploymentId,
                          @JsonProperty("email") String email,
                          @JsonProperty("name") String name,
                          @JsonProperty("cognitive_profile") CognitiveProfile cognitiveProfile,
                          @JsonProperty("privacy_settings") PrivacySettings privacySettings,
                          @JsonProperty("created_at") String createdAt,
                          @JsonProperty("updated_at") String updatedAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.ltiUserId = ltiUserId;
        this.ltiDeploymentId = ltiDeploymentId;
        this.email = email;
        this.name = name;
        this.cognitiveProfile = cognitiveProfile;
        this.privacySettings = privacySettings;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }
    
    @JsonProperty("id")
    public String getId() {
        return id;
    }
    
    @JsonProperty("tenant_id")
    public String getTenantId() {
        return tenantId;
    }
    
    @JsonProperty("lti_user_id")
    public String getLtiUserId() {
        return ltiUserId;
    }
    
    @JsonProperty("lti_deployment_id")
    public String getLtiDeploymentId() {
        return ltiDeploymentId;
    }
    
    @JsonProperty("email")
    public String getEmail() {
        return email;
    }
    
    @JsonProperty("name")
    public String getName() {
        return name;
    }
    
    @JsonProperty("cognitive_profile")
    public CognitiveProfile getCognitiveProfile() {
        return cognitiveProfile;
    }
    
    @JsonProperty("privacy_settings")
    public PrivacySettings getPrivacySettings() {
        return privacySettings;
    }
    
    @JsonProperty("created_at")
    public String getCreatedAt() {
        return createdAt;
    }
    
    @JsonProperty("updated_at")
    public String getUpdatedAt() {
        return updatedAt;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LearnerProfile that = (LearnerProfile) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(tenantId, that.tenantId) &&
                Objects.equals(ltiUserId, that.ltiUserId) &&
                Objects.equals(ltiDeploymentId, that.ltiDeploymentId) &&
                Objects.equals(email, that.email) &&
                Objects.equals(name, that.name) &&
                Objects.equals(cognitiveProfile, that.cognitiveProfile) &&
                Objects.equals(privacySettings, that.privacySettings) &&
                Objects.equals(createdAt, that.createdAt) &&
                Objects.equals(updatedAt, that.updatedAt);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, tenantId, ltiUserId, ltiDeploymentId, email, name,
                cognitiveProfile, privacySettings, createdAt, updatedAt);
    }
    
    @Override
    public String toString() {
        return String.format("LearnerProfile{id='%s', tenant='%s', ltiUser='%s', deployment='%s'}",
                id, tenantId, ltiUserId, ltiDeploymentId);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Adaptive learning parameters estimated for the learner.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CognitiveProfile(
            @JsonProperty("forgetting_curve_s") double forgettingCurveS,
            @JsonProperty("learning_velocity") double learningVelocity,
            @JsonProperty("optimal_difficulty") double optimalDifficulty,
            @JsonProperty("preferred_modality") String preferredModality) {
        
        public static CognitiveProfile defaults() {
            return new CognitiveProfile(1.0, 1.0, 0.7, "visual");
        }
    }
    
    /**
     * Consent flags recorded for the learner.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PrivacySettings(
            @JsonProperty("data_sharing_consent") boolean dataSharingConsent,
            @JsonProperty("ai_interaction_consent") boolean aiInteractionConsent,
            @JsonProperty("anonymous_analytics") boolean anonymousAnalytics) {
    }
    
    public static class Builder {
        private String id;
        private String tenantId;
        private String ltiUserId;
        private String ltiDeploymentId;
        private String email;
        private String name;
        private CognitiveProfile cognitiveProfile = CognitiveProfile.defaults();
        private PrivacySettings privacySettings = new PrivacySettings(false, false, false);
        private String createdAt;
        private String updatedAt;
        
        public Builder id(String id) {
            this.id = id;
            return this;
        }
        
        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }
        
        public Builder ltiUserId(String ltiUserId) {
            this.ltiUserId = ltiUserId;
            return this;
        }
        
        public Builder ltiDeploymentId(String ltiDeploymentId) {
            this.ltiDeploymentId = ltiDeploymentId;
            return this;
        }
        
        public Builder email(String email) {
            this.email = email;
            return this;
        }
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder cognitiveProfile(CognitiveProfile cognitiveProfile) {
            this.cognitiveProfile = cognitiveProfile;
            return this;
        }
        
        public Builder privacySettings(PrivacySettings privacySettings) {
            this.privacySettings = privacySettings;
            return this;
        }
        
        public Builder createdAt(String createdAt) {
            this.createdAt = createdAt;
            return this;
        }
        
        public Builder updatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }
        
        public LearnerProfile build() {
            return new LearnerProfile(id, tenantId, ltiUserId, ltiDeploymentId, email, name,
                    cognitiveProfile, privacySettings, createdAt, updatedAt);
        }
    }
}
