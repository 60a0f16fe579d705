package com.example.demo.pdfform.exception;

/**
 * Stage names reported on error events and exceptions.
 */
public final class Stage {
    public static final String LOAD_CATALOG = "load_catalog";
    public static final String FIND_FORM = "find_form";
    public static final String FILTER_FORMS = "filter_forms";
    public static final String FOUND_FORM = "found_form";
    public static final String CHECK_URL = "check_url";
    public static final String CREATE_DIR = "create_dir";
    public static final String DOWNLOAD_PDF = "download_pdf";
    public static final String DOWNLOADING = "downloading";
    public static final String SAVE_METADATA = "saving_metadata";
    public static final String COMPLETE = "complete";
    public static final String VALIDATE_INPUT = "validate_input";
    public static final String LIST_FIELDS = "list_fields";
    public static final String EXPORT_JSON = "export_json";
    public static final String LOAD_TEMPLATE = "load_template";
    public static final String RESOLVE_DOCUMENT = "resolve_document";
    public static final String FILL_PDF = "fill_pdf";
    public static final String FLATTEN = "flatten";
    public static final String FILL_FROM_CASE = "fill_from_case";
    public static final String CREATE = "create";
    public static final String LOAD = "load";
    public static final String SAVE = "save";
    public static final String VALIDATE = "validate";
    public static final String LIST = "list";
    public static final String LOAD_SCENARIO = "load_scenario";
    public static final String RUN_SCENARIO = "run_scenario";

    private Stage() {
    }
}
