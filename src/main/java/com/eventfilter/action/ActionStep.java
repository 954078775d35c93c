package com.eventfilter.action;

import com.eventfilter.filter.FilterSpec;

/**
 * action 的单个匹配步骤，所有字段均可为空。
 */
public record ActionStep(
    String event,
    String selector,
    String tagName,
    String href,
    MatchingMode hrefMatching,
    String text,
    MatchingMode textMatching,
    String url,
    MatchingMode urlMatching,
    FilterSpec properties
) {
    public static Builder builder() {
        return new Builder();
    }

    public static ActionStep ofEvent(String event) {
        return builder().event(event).build();
    }

    public static final class Builder {
        private String event;
        private String selector;
        private String tagName;
        private String href;
        private MatchingMode hrefMatching;
        private String text;
        private MatchingMode textMatching;
        private String url;
        private MatchingMode urlMatching;
        private FilterSpec properties;

        private Builder() {
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder selector(String selector) {
            this.selector = selector;
            return this;
        }

        public Builder tagName(String tagName) {
            this.tagName = tagName;
            return this;
        }

        public Builder href(String href, MatchingMode matching) {
            this.href = href;
            this.hrefMatching = matching;
            return this;
        }

        public Builder text(String text, MatchingMode matching) {
            this.text = text;
            this.textMatching = matching;
            return this;
        }

        public Builder url(String url, MatchingMode matching) {
            this.url = url;
            this.urlMatching = matching;
            return this;
        }

        public Builder properties(FilterSpec properties) {
            this.properties = properties;
            return this;
        }

        public ActionStep build() {
            return new ActionStep(event, selector, tagName, href, hrefMatching, text, textMatching, url,
                urlMatching, properties);
        }
    }
}
