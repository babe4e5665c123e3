package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;

public class WidgetLocatorTest {

    private SelectorCascade cascade;
    private ProbeDocument host;
    private ProbeDocument widgetDoc;
    private Locator frame;
    private WidgetLocator locator;

    @BeforeEach
    public void setUp() {
        cascade = Mockito.mock(SelectorCascade.class);
        host = Mockito.mock(ProbeDocument.class);
        widgetDoc = Mockito.mock(ProbeDocument.class);
        frame = Mockito.mock(Locator.class);
        locator = new WidgetLocator(cascade, Arrays.asList("chat.pega.digital"));
    }

    @Test
    public void vendorHintsComeFirstInCandidateOrder() {
        List<LocatorCandidate> candidates = locator.getCandidates();
        Assertions.assertEquals("iframe[src*=\"chat.pega.digital\" i]", candidates.get(0).describe());
        Assertions.assertEquals("iframe[src*=\"chat\" i]", candidates.get(1).describe());
        Assertions.assertEquals("iframe[src*=\"support\" i]", candidates.get(candidates.size() - 1).describe());
    }

    @Test
    public void locate_returnsContentOfPrioritizedMatch() {
        Mockito.when(cascade.find(eq(host), anyList())).thenReturn(Discovery.found(frame, "iframe[src*=\"chat\" i]"));
        Mockito.when(host.contentDocument(frame)).thenReturn(Optional.of(widgetDoc));

        Discovery<ProbeDocument> out = locator.locate(host);

        Assertions.assertTrue(out.isFound());
        Assertions.assertSame(widgetDoc, out.get());
        Mockito.verify(widgetDoc).name();
        Mockito.verify(cascade, Mockito.never()).scan(any(), any(), any());
    }

    @Test
    public void locate_fallsBackToFrameScan() {
        Mockito.when(cascade.find(eq(host), anyList())).thenReturn(Discovery.notFound("exhausted 9 candidates"));
        Mockito.when(cascade.scan(eq(host), eq("iframe"), any())).thenReturn(Discovery.found(frame, "iframe #2"));
        Mockito.when(host.contentDocument(frame)).thenReturn(Optional.of(widgetDoc));

        Discovery<ProbeDocument> out = locator.locate(host);

        Assertions.assertTrue(out.isFound());
        Assertions.assertEquals("iframe #2", out.getStrategy());
    }

    @Test
    public void locate_reportsNotFoundWhenNoFrameMatches() {
        Mockito.when(cascade.find(eq(host), anyList())).thenReturn(Discovery.notFound("exhausted 9 candidates"));
        Mockito.when(cascade.scan(eq(host), eq("iframe"), any())).thenReturn(Discovery.notFound("scanned 0 elements of iframe"));

        Discovery<ProbeDocument> out = locator.locate(host);

        Assertions.assertFalse(out.isFound());
        Assertions.assertEquals("Chat widget iframe not found", out.getReason());
    }

    @Test
    public void locate_reportsInaccessibleContent() {
        Mockito.when(cascade.find(eq(host), anyList())).thenReturn(Discovery.found(frame, "iframe[title*=\"chat\" i]"));
        Mockito.when(host.contentDocument(frame)).thenReturn(Optional.empty());

        Discovery<ProbeDocument> out = locator.locate(host);

        Assertions.assertFalse(out.isFound());
        Assertions.assertEquals("Could not access iframe content", out.getReason());
    }

    @Test
    public void looksLikeChatFrame_checksSrcAndTitle() {
        Locator bySrc = Mockito.mock(Locator.class);
        Mockito.when(bySrc.getAttribute("src")).thenReturn("https://cdn.example.com/Messenger/v2");
        Locator byTitle = Mockito.mock(Locator.class);
        Mockito.when(byTitle.getAttribute("title")).thenReturn("Virtual Assistant");
        Locator unrelated = Mockito.mock(Locator.class);
        Mockito.when(unrelated.getAttribute("src")).thenReturn("https://video.example.com/embed");

        Assertions.assertTrue(WidgetLocator.looksLikeChatFrame(bySrc));
        Assertions.assertTrue(WidgetLocator.looksLikeChatFrame(byTitle));
        Assertions.assertFalse(WidgetLocator.looksLikeChatFrame(unrelated));
    }
}
