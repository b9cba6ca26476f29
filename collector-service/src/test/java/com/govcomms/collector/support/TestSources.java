package com.govcomms.collector.support;

import com.govcomms.collector.entity.Source;
import com.govcomms.collector.entity.SourceKind;

public final class TestSources {

    private TestSources() {
    }

    public static Source blog(long id, String url) {
        return Source.builder()
                .id(id)
                .name("Blog " + id)
                .url(url)
                .kind(SourceKind.BLOG)
                .enabled(true)
                .build();
    }

    public static Source video(long id, String channelId) {
        return Source.builder()
                .id(id)
                .name("Channel " + id)
                .url("https://www.youtube.com/channel/" + channelId)
                .kind(SourceKind.VIDEO)
                .channelId(channelId)
                .enabled(true)
                .build();
    }
}
