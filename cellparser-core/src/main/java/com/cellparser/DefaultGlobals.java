package com.cellparser;

import java.util.Set;

/**
 * Names that cells may read without another cell defining them: the
 * ECMAScript built-ins and the browser globals a notebook runs with.
 */
public final class DefaultGlobals {

    public static final Set<String> NAMES = Set.of(
        "Array",
        "ArrayBuffer",
        "atob",
        "AudioContext",
        "BigInt",
        "Blob",
        "Boolean",
        "btoa",
        "cancelAnimationFrame",
        "clearInterval",
        "clearTimeout",
        "console",
        "crypto",
        "CustomEvent",
        "DataView",
        "Date",
        "decodeURI",
        "decodeURIComponent",
        "devicePixelRatio",
        "document",
        "encodeURI",
        "encodeURIComponent",
        "Error",
        "escape",
        "eval",
        "fetch",
        "File",
        "FileList",
        "FileReader",
        "Float32Array",
        "Float64Array",
        "Function",
        "Headers",
        "Image",
        "ImageData",
        "Infinity",
        "Int16Array",
        "Int32Array",
        "Int8Array",
        "Intl",
        "isFinite",
        "isNaN",
        "JSON",
        "Map",
        "Math",
        "NaN",
        "navigator",
        "Number",
        "Object",
        "parseFloat",
        "parseInt",
        "Path2D",
        "performance",
        "Promise",
        "Proxy",
        "RangeError",
        "ReferenceError",
        "Reflect",
        "RegExp",
        "requestAnimationFrame",
        "Set",
        "setInterval",
        "setTimeout",
        "String",
        "Symbol",
        "SyntaxError",
        "TextDecoder",
        "TextEncoder",
        "this",
        "TypeError",
        "Uint16Array",
        "Uint32Array",
        "Uint8Array",
        "Uint8ClampedArray",
        "undefined",
        "unescape",
        "URIError",
        "URL",
        "WeakMap",
        "WeakSet",
        "WebSocket",
        "Worker",
        "window"
    );

    private DefaultGlobals() {
    }
}
