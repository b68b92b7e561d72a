/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.macrobridge.testing;

import com.google.common.collect.ImmutableMap;
import io.macrobridge.base.macro.ExecutionResult;
import io.macrobridge.base.macro.MacroDescriptor;
import io.macrobridge.base.macro.MacroKind;
import io.macrobridge.main.web.dto.MacroExecutionRequestDto;
import org.testng.annotations.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.macrobridge.base.metadata.StandardErrorCode.INVALID_MACRO_NAME;
import static io.macrobridge.base.metadata.StandardErrorCode.INVALID_PARAMETER;
import static io.macrobridge.base.metadata.StandardErrorCode.MACRO_EXECUTION_ERROR;
import static io.macrobridge.base.metadata.StandardErrorCode.MACRO_NOT_FOUND;
import static io.macrobridge.testing.WebApplicationExceptionAssert.assertWebApplicationException;
import static org.assertj.core.api.Assertions.assertThat;

public class TestMacroResource
        extends RequireMacroBridgeServer
{
    @Test
    public void testListMacros()
    {
        List<MacroDescriptor> macros = listMacros();

        assertThat(macros).extracting(MacroDescriptor::getName)
                .containsExactly("calculate_bonus", "employee_count", "employees_by_department", "greet", "high_earners", "safe_divide", "salary_stats");
        assertThat(macros).filteredOn(macro -> macro.getName().equals("salary_stats"))
                .singleElement()
                .extracting(MacroDescriptor::getKind)
                .isEqualTo(MacroKind.TABLE);
    }

    @Test
    public void testGetMacro()
    {
        MacroDescriptor greet = getMacro("greet");
        assertThat(greet.getKind()).isEqualTo(MacroKind.SCALAR);
        assertThat(greet.getParameters()).containsExactly("name");
        assertThat(greet.getParameterTypes()).hasSize(1);

        assertWebApplicationException(() -> getMacro("nonexistent_macro"))
                .hasHTTPStatus(404)
                .hasErrorCode(MACRO_NOT_FOUND)
                .hasErrorMessageMatches("Macro 'nonexistent_macro' not found");

        assertWebApplicationException(() -> getMacro("1greet"))
                .hasHTTPStatus(400)
                .hasErrorCode(INVALID_MACRO_NAME);
    }

    @Test
    public void testExecuteScalarMacro()
    {
        ExecutionResult result = executeMacro("greet", new MacroExecutionRequestDto(ImmutableMap.of("name", "World")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo("Hello, World!");
        assertThat(result.getColumns()).isNull();
        assertThat(result.getRowCount()).isEqualTo(1);
    }

    @Test
    public void testExecuteTableMacro()
    {
        ExecutionResult result = executeMacro("employees_by_department", new MacroExecutionRequestDto(ImmutableMap.of("dept", "Engineering")));

        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getColumns()).containsExactly("id", "name", "department", "salary", "hire_date");
        assertThat((List<?>) result.getData()).allSatisfy(row -> assertThat(((List<?>) row).get(2)).isEqualTo("Engineering"));
    }

    @Test
    public void testExecuteWithStructuredParameters()
    {
        ExecutionResult result = executeMacro("high_earners", new MacroExecutionRequestDto(ImmutableMap.of("min_salary", 75000)));
        assertThat(result.getRowCount()).isEqualTo(2);

        ExecutionResult withoutParameters = executeMacro("employee_count", new MacroExecutionRequestDto(ImmutableMap.of()));
        assertThat(withoutParameters.getData()).isEqualTo(List.of(List.of(5)));
    }

    @Test
    public void testExecuteMacroErrors()
    {
        assertWebApplicationException(() -> executeMacro("nonexistent_macro", new MacroExecutionRequestDto(ImmutableMap.of())))
                .hasHTTPStatus(404)
                .hasErrorCode(MACRO_NOT_FOUND);

        assertWebApplicationException(() -> executeMacro("greet", new MacroExecutionRequestDto(ImmutableMap.of("name", "World", "extra", "value"))))
                .hasHTTPStatus(400)
                .hasErrorCode(INVALID_PARAMETER)
                .hasErrorMessageMatches("Too many parameters. Expected 1, got 2");

        assertWebApplicationException(() -> executeMacro("calculate_bonus", new MacroExecutionRequestDto(ImmutableMap.of("percentage", 10))))
                .hasHTTPStatus(400)
                .hasErrorCode(INVALID_PARAMETER)
                .hasErrorDetail("parameter_name", "salary");

        assertWebApplicationException(() -> executeMacro("calculate_bonus", new MacroExecutionRequestDto(ImmutableMap.of("salary", 1000))))
                .hasHTTPStatus(500)
                .hasErrorCode(MACRO_EXECUTION_ERROR)
                .hasErrorDetail("macro_name", "calculate_bonus");

        assertThat(executeMacro("greet", "{\"parameters\": ").getStatusCode()).isEqualTo(400);
        assertThat(executeMacro("employee_count", "{}").getStatusCode()).isEqualTo(200);
    }

    @Test
    public void testRequestLimits()
    {
        Map<String, Object> tooMany = new HashMap<>();
        for (int i = 0; i <= MacroExecutionRequestDto.MAX_PARAMETERS; i++) {
            tooMany.put("p" + i, i);
        }
        assertWebApplicationException(() -> executeMacro("greet", new MacroExecutionRequestDto(tooMany)))
                .hasHTTPStatus(400)
                .hasErrorCode(INVALID_PARAMETER)
                .hasErrorMessageMatches("Too many parameters \\(max 50\\)");

        assertWebApplicationException(() -> executeMacro("greet", new MacroExecutionRequestDto(ImmutableMap.of("_name", "World"))))
                .hasHTTPStatus(400)
                .hasErrorMessageMatches("Parameter name '_name' is not allowed");

        assertWebApplicationException(() -> executeMacro("greet", new MacroExecutionRequestDto(ImmutableMap.of("$name", "World"))))
                .hasHTTPStatus(400)
                .hasErrorMessageMatches("Parameter name '\\$name' is not allowed");

        assertWebApplicationException(() -> executeMacro("greet", new MacroExecutionRequestDto(ImmutableMap.of("name", "x".repeat(MacroExecutionRequestDto.MAX_STRING_VALUE_LENGTH + 1)))))
                .hasHTTPStatus(400)
                .hasErrorMessageMatches("Parameter 'name' value too long");
    }
}
