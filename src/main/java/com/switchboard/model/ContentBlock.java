package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One block of structured message content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentBlock {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE_URL = "image_url";

    @JsonProperty("type")
    private String type;

    @JsonProperty("text")
    private String text;

    @JsonProperty("image_url")
    private ImageUrl imageUrl;

    public static ContentBlock text(String text) {
        return ContentBlock.builder().type(TYPE_TEXT).text(text).build();
    }

    public static ContentBlock image(String url) {
        return ContentBlock.builder().type(TYPE_IMAGE_URL).imageUrl(new ImageUrl(url, null)).build();
    }

    @JsonIgnore
    public boolean isText() {
        return TYPE_TEXT.equals(type);
    }

    @JsonIgnore
    public boolean isImage() {
        return TYPE_IMAGE_URL.equals(type);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ImageUrl {

        @JsonProperty("url")
        private String url;

        @JsonProperty("detail")
        private String detail;
    }
}
