package com.phillippitts.bbdetector.service.hotkey.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.NativeInputEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.phillippitts.bbdetector.service.hotkey.GlobalKeyHook;
import com.phillippitts.bbdetector.service.hotkey.KeyNameMapper;
import com.phillippitts.bbdetector.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Production GlobalKeyHook backed by JNativeHook.
 * Converts NativeKeyEvent into NormalizedKeyEvent for the Hotkey subsystem.
 */
@Component
public class JNativeHookGlobalKeyHook implements GlobalKeyHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookGlobalKeyHook.class);

    private volatile Consumer<NormalizedKeyEvent> listener;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            registered.set(true);
            LOG.info("Registered JNativeHook global key listener");
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.get()) {
            return;
        }
        try {
            GlobalScreen.removeNativeKeyListener(this);
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook", e);
        } finally {
            registered.set(false);
        }
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.PRESSED);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.RELEASED);
    }

    @Override
    public void nativeKeyTyped(NativeKeyEvent nativeEvent) {
        // typed events carry characters, not keys
    }

    private void emit(NativeKeyEvent ne, NormalizedKeyEvent.Type type) {
        Consumer<NormalizedKeyEvent> l = this.listener;
        if (l == null) {
            return;
        }
        String keyText = NativeKeyEvent.getKeyText(ne.getKeyCode());
        if (keyText == null || keyText.isBlank()) {
            return;
        }
        NormalizedKeyEvent e = new NormalizedKeyEvent(type, KeyNameMapper.canonical(keyText),
                extractModifiers(ne), System.currentTimeMillis());
        try {
            l.accept(e);
        } catch (RuntimeException ex) {
            LOG.warn("Listener error for {}: {}", e, ex.toString());
        }
    }

    private static Set<String> extractModifiers(NativeInputEvent ne) {
        int m = ne.getModifiers();
        Set<String> mods = new HashSet<>();
        if ((m & (NativeInputEvent.CTRL_MASK | NativeInputEvent.META_MASK)) != 0) {
            mods.add(KeyNameMapper.CONTROL);
        }
        if ((m & NativeInputEvent.SHIFT_MASK) != 0) {
            mods.add(KeyNameMapper.SHIFT);
        }
        if ((m & NativeInputEvent.ALT_MASK) != 0) {
            mods.add(KeyNameMapper.ALT);
        }
        return mods;
    }
}
